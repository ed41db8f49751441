package com.narrateplus.playback;

import com.narrateplus.model.PlaybackCursor;
import java.util.concurrent.CompletableFuture;
import lombok.extern.slf4j.Slf4j;

/**
 * Connects a {@link MediaSessionHost} to the player: host controls become transport
 * verbs, player events become session state.
 */
@Slf4j
public class MediaSessionBridge implements PlaybackListener, MediaSessionHost.MediaSessionCallbacks
{
    private final PlaybackStateMachine player;
    private final MediaSessionHost host;

    private volatile String title = "";

    public MediaSessionBridge(PlaybackStateMachine player, MediaSessionHost host)
    {
        this.player = player;
        this.host = host;
    }

    public void attach(String chapterTitle)
    {
        this.title = chapterTitle == null ? "" : chapterTitle;
        host.setCallbacks(this);
        player.addListener(this);
        host.setMetadata(title, player.getChapterDurationSeconds());
    }

    public void detach()
    {
        player.removeListener(this);
        host.setCallbacks(null);
    }

    @Override
    public void onPlay()
    {
        logFailure("play", player.play());
    }

    @Override
    public void onPause()
    {
        logFailure("pause", player.pause());
    }

    @Override
    public void onSeekToSegment(int index)
    {
        logFailure("seek", player.seekToSegment(index));
    }

    @Override
    public void onNext()
    {
        logFailure("next", player.skipNext());
    }

    @Override
    public void onPrevious()
    {
        logFailure("previous", player.skipPrevious());
    }

    @Override
    public void onStateChanged(PlaybackState state)
    {
        host.setPlaybackState(state, player.getChapterPositionSeconds(), player.getSpeed());
    }

    @Override
    public void onCursorChanged(PlaybackCursor cursor)
    {
        host.setPlaybackState(player.getState(), player.getChapterPositionSeconds(), player.getSpeed());
    }

    @Override
    public void onChapterDurationChanged(double seconds, boolean exact)
    {
        host.setMetadata(title, seconds);
    }

    private static void logFailure(String command, CompletableFuture<Void> result)
    {
        result.whenComplete((v, err) ->
        {
            if (err != null)
            {
                log.debug("Media session {} ignored: {}", command, err.getMessage());
            }
        });
    }
}

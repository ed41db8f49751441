package com.narrateplus.progress;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import com.narrateplus.model.Segment;
import com.narrateplus.text.TextSegmenter;
import com.narrateplus.tts.Wav;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;

public class ChapterProgressTest
{
    private final ChapterProgressRegistry registry = new ChapterProgressRegistry();

    private static Segment at(int index, String text, int tier)
    {
        return Segment.of(index, text).withAudio(Wav.silence(0.5), tier, 0.5);
    }

    @Test
    public void firstResultWins()
    {
        ChapterProgress p = registry.init("ch", TextSegmenter.split("A. B. C. D."));

        assertTrue(p.isGenerating());
        assertTrue(p.markGenerated(at(1, "B.", 0)));
        assertFalse(p.markGenerated(at(1, "B.", 2)));

        assertEquals(0, p.qualityOf(1));
        assertEquals(Segment.UNDEFINED_TIER, p.qualityOf(0));
        assertEquals(25, p.percentComplete());
        assertEquals(25, registry.percentComplete("ch"));
    }

    @Test
    public void upgradesOnlyMoveUp()
    {
        ChapterProgress p = registry.init("ch", TextSegmenter.split("A. B."));
        p.markGenerated(at(0, "A.", 1));

        assertFalse(p.replaceUpgraded(at(0, "A.", 1)));
        assertFalse(p.replaceUpgraded(at(0, "A.", 0)));
        assertTrue(p.replaceUpgraded(at(0, "A.", 3)));
        assertEquals(3, p.qualityOf(0));
        assertEquals(3, p.getSegment(0).get().getQualityTier());

        // An upgrade for a segment with no first result is recorded as well.
        assertTrue(p.replaceUpgraded(at(1, "B.", 2)));
        assertEquals(Arrays.asList(0, 1), List.copyOf(p.getGeneratedIndices()));
        assertEquals(2, (int) p.getSegmentQuality().get(1));
    }

    @Test
    public void processingIndexFollowsTheActiveRequest()
    {
        ChapterProgress p = registry.init("ch", TextSegmenter.split("A. B. C."));
        assertEquals(-1, p.getProcessingIndex());

        p.setProcessingIndex(1);
        p.setProcessingIndex(2);
        p.clearProcessingIndex(1);
        assertEquals(2, p.getProcessingIndex());

        p.clearProcessingIndex(2);
        assertEquals(-1, p.getProcessingIndex());

        p.setProcessingIndex(0);
        p.markGenerationComplete();
        assertFalse(p.isGenerating());
        assertEquals(-1, p.getProcessingIndex());
    }

    @Test
    public void storedSegmentsHydrateARecord()
    {
        List<Segment> stored = Arrays.asList(
                at(0, "A.", 2),
                Segment.of(1, "B."),
                at(2, "C.", 0));

        ChapterProgress p = registry.loadFromStorage("ch", stored);

        assertFalse(p.isGenerating());
        assertEquals(3, p.getTotalSegments());
        assertEquals(Arrays.asList(0, 2), List.copyOf(p.getGeneratedIndices()));
        assertEquals(2, p.qualityOf(0));
        assertEquals("B.", p.segmentText(1).get());
        assertEquals(67, p.percentComplete());
    }

    @Test
    public void clearForgetsTheChapter()
    {
        registry.init("a", TextSegmenter.split("A."));
        registry.init("b", TextSegmenter.split("B."));

        registry.clear("a");
        assertFalse(registry.get("a").isPresent());
        assertTrue(registry.get("b").isPresent());
        assertEquals(0, registry.percentComplete("a"));

        registry.clearAll();
        assertFalse(registry.get("b").isPresent());
    }
}

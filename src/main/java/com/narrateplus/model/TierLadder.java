package com.narrateplus.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Tier configurations for one language, indexed by tier number. An entry may be
 * absent when no voice exists at that quality for the language.
 */
public final class TierLadder
{
    private final List<TierConfig> tiers;
    private final int maxAvailableTier;

    public TierLadder(List<TierConfig> tiers)
    {
        this.tiers = Collections.unmodifiableList(new ArrayList<>(tiers));

        int max = -1;
        for (int i = 0; i < this.tiers.size(); i++)
        {
            if (this.tiers.get(i) != null)
            {
                max = i;
            }
        }
        this.maxAvailableTier = max;
    }

    public int size()
    {
        return tiers.size();
    }

    /**
     * Highest tier with a configuration, or -1 for an empty ladder.
     */
    public int getMaxAvailableTier()
    {
        return maxAvailableTier;
    }

    public Optional<TierConfig> tier(int tier)
    {
        if (tier < 0 || tier >= tiers.size())
        {
            return Optional.empty();
        }
        return Optional.ofNullable(tiers.get(tier));
    }

    public boolean isAvailable(int tier)
    {
        return tier(tier).isPresent();
    }

    /**
     * Nearest available tier at or below {@code tier}, or -1.
     */
    public int walkDown(int tier)
    {
        int t = Math.min(tier, tiers.size() - 1);
        while (t >= 0 && tiers.get(t) == null)
        {
            t--;
        }
        return t;
    }

    /**
     * Nearest available tier at or above {@code tier}, or -1.
     */
    public int walkUp(int tier)
    {
        for (int t = Math.max(0, tier); t < tiers.size(); t++)
        {
            if (tiers.get(t) != null)
            {
                return t;
            }
        }
        return -1;
    }

    /**
     * Tier number of a configuration in this ladder, or -1.
     */
    public int indexOf(TierConfig config)
    {
        return config == null ? -1 : tiers.indexOf(config);
    }

    @Override
    public String toString()
    {
        return "TierLadder" + tiers;
    }
}

package org.gridiron.tool;

import org.gridiron.lineup.PlayerNormalizer;
import org.gridiron.service.LineupService;
import org.gridiron.service.YahooApi;

public record ToolContext(
    YahooApi yahoo,
    LineupService lineupService,
    PlayerNormalizer normalizer
) {}

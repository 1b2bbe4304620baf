package org.gridiron.service;

import org.gridiron.lineup.LineupResult;

/**
 * A lineup result together with the request context it was built for.
 *
 * @param insight optional narrative from the language model, null when not requested or unavailable
 */
public record LineupReport(String leagueKey, String teamKey, Integer week, LineupResult result, String insight) {}

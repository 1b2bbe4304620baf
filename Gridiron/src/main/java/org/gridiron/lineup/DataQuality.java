package org.gridiron.lineup;

public record DataQuality(int totalPlayers, int validPlayers, int playersWithProjections, int playersWithMatchupData) {

    public static DataQuality empty(int totalPlayers) {
        return new DataQuality(totalPlayers, 0, 0, 0);
    }
}

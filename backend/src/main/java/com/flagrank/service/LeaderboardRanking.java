package com.flagrank.service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Orders standings and assigns dense ranks.
 * <p>
 * Teams with at least one solve come first, by score descending then by earlier last solve. Teams without
 * a solve follow, by score descending. Two teams share a rank only when both score and last solve time are
 * equal. Team name and id break the remaining ties so the order is stable between rebuilds.
 */
public final class LeaderboardRanking {

    static final Comparator<TeamStanding> ORDER = Comparator
            .comparing((TeamStanding standing) -> standing.lastSolveAt() == null)
            .thenComparing(TeamStanding::score, Comparator.reverseOrder())
            .thenComparing(TeamStanding::lastSolveAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(TeamStanding::teamName, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(TeamStanding::teamId);

    private LeaderboardRanking() {
    }

    public static List<RankedTeam> rank(List<TeamStanding> standings) {
        List<TeamStanding> ordered = new ArrayList<>(standings);
        ordered.sort(ORDER);

        List<RankedTeam> ranked = new ArrayList<>(ordered.size());
        int rank = 0;
        TeamStanding previous = null;
        for (TeamStanding standing : ordered) {
            if (previous == null || !sharesRank(previous, standing)) {
                rank++;
            }
            ranked.add(new RankedTeam(
                    rank,
                    standing.teamId(),
                    standing.teamName(),
                    standing.score(),
                    standing.lastSolveAt()
            ));
            previous = standing;
        }
        return List.copyOf(ranked);
    }

    private static boolean sharesRank(TeamStanding left, TeamStanding right) {
        return left.score() == right.score()
                && Objects.equals(left.lastSolveAt(), right.lastSolveAt());
    }
}

package com.questrail.navigation.planner;

import com.questrail.navigation.api.Move;
import com.questrail.navigation.api.Position;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static com.questrail.navigation.api.Move.*;
import static org.junit.jupiter.api.Assertions.*;

class CandidateMovesTest {

    @Test
    void largerRowDeltaMakesRowPrimary() {
        assertEquals(List.of(DOWN, RIGHT, LEFT, UP),
                CandidateMoves.ordered(new Position(2, 2), new Position(21, 19), FallbackOrder.REVERSE_SECONDARY_FIRST));
    }

    @Test
    void largerColumnDeltaMakesColumnPrimary() {
        assertEquals(List.of(LEFT, UP, DOWN, RIGHT),
                CandidateMoves.ordered(-1, -5, FallbackOrder.REVERSE_SECONDARY_FIRST));
    }

    @Test
    void tieGoesToRowAxis() {
        assertEquals(CandidateMoves.Axis.ROW, CandidateMoves.primaryAxis(3, -3));
        assertEquals(List.of(UP, RIGHT, LEFT, DOWN),
                CandidateMoves.ordered(-3, 3, FallbackOrder.REVERSE_SECONDARY_FIRST));
    }

    @Test
    void zeroDeltaDefaultsToDownAndRight() {
        assertEquals(DOWN, CandidateMoves.rowMove(0));
        assertEquals(RIGHT, CandidateMoves.columnMove(0));
        // Same row: column is primary, the secondary row direction defaults to DOWN.
        assertEquals(List.of(RIGHT, DOWN, UP, LEFT),
                CandidateMoves.ordered(0, 4, FallbackOrder.REVERSE_SECONDARY_FIRST));
        assertEquals(List.of(UP, RIGHT, LEFT, DOWN),
                CandidateMoves.ordered(-4, 0, FallbackOrder.REVERSE_SECONDARY_FIRST));
    }

    @Test
    void reversePrimaryFirstSwapsTheFallbacks() {
        assertEquals(List.of(DOWN, RIGHT, UP, LEFT),
                CandidateMoves.ordered(5, 2, FallbackOrder.REVERSE_PRIMARY_FIRST));
    }

    @Test
    void alwaysFourDistinctDirectionalMoves() {
        for (int dr = -3; dr <= 3; dr++) {
            for (int dc = -3; dc <= 3; dc++) {
                for (FallbackOrder order : FallbackOrder.values()) {
                    List<Move> moves = CandidateMoves.ordered(dr, dc, order);
                    assertEquals(4, moves.size());
                    assertEquals(EnumSet.of(UP, DOWN, LEFT, RIGHT), EnumSet.copyOf(moves));
                }
            }
        }
    }
}

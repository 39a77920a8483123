package ai.holdem.player.ai;

import static org.junit.jupiter.api.Assertions.*;

import ai.holdem.game.Cards;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class HandStrengthTest {

    private static final double EPS = 1e-9;

    private static double preflop(String hole) {
        return HandStrength.preflop(Cards.of(hole));
    }

    private static double postflop(String hole, String board) {
        return HandStrength.postflop(Cards.of(hole), Cards.of(board));
    }

    @Nested
    @DisplayName("Preflop")
    class Preflop {

        @Test
        void pairsScaleWithRank() {
            assertEquals(1.0, preflop("Ah Ad"), EPS);
            assertEquals(0.5, preflop("2h 2d"), EPS);
            assertEquals(0.5 + 5 / 12.0 * 0.5, preflop("7h 7d"), EPS);
        }

        @Test
        void premiumHandsHaveFloors() {
            assertEquals(0.85, preflop("Th Td"), EPS);
            assertEquals(0.8, preflop("Ah Kd"), EPS);
            assertEquals(0.75, preflop("Ah Jd"), EPS);
        }

        @Test
        void suitedConnectorsGetBonuses() {
            assertEquals(13 / 24.0 * 0.6 + 0.06 + 0.04, preflop("9s 8s"), EPS);
            assertEquals(12 / 24.0 * 0.6 + 0.02, preflop("9s 7d"), EPS);
        }

        @Test
        void wideGapsArePenalised() {
            assertEquals(5 / 24.0 * 0.6 - 0.05, preflop("7c 2d"), EPS);
        }

        @Test
        void needsExactlyTwoCards() {
            assertThrows(IllegalArgumentException.class, () -> preflop("Ah"));
        }
    }

    @Nested
    @DisplayName("Post-flop")
    class Postflop {

        @Test
        void topPairBonus() {
            assertEquals(0.35 + 0.08, postflop("Ah Kd", "As 7c 2d"), EPS);
        }

        @Test
        void pairedBoardWithoutAHitIsDiscounted() {
            assertEquals(0.35 - 0.1 + 0.08, postflop("Kh Qd", "7c 7d 2s"), EPS);
        }

        @Test
        void flushDrawBonus() {
            assertEquals(0.15 + 0.1, postflop("Ah 9h", "Kh 5h 2c"), EPS);
        }

        @Test
        void straightDrawBonus() {
            assertEquals(0.15 + 0.06, postflop("9c 8d", "7h 6s 2c"), EPS);
        }

        @Test
        void noDrawBonusOnTheRiver() {
            assertEquals(0.15, postflop("9c 8d", "7h 6s 2c Kd Jd"), EPS);
        }

        @Test
        void madeHandsUseTheCategoryBase() {
            assertEquals(0.9, postflop("7h 7d", "7c 2s 2d"), EPS);
            assertEquals(1.0, postflop("Ah Kh", "Qh Jh Th"), EPS);
        }
    }
}

package ai.holdem.game;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Hand classification, tie-break ordering and best-of-seven selection.
 */
class HandEvaluatorTest {

    private static HandEvaluation eval(String cards) {
        return HandEvaluator.evaluate(Cards.of(cards));
    }

    @Nested
    @DisplayName("Categories")
    class Categories {

        @Test
        void royalFlush() {
            HandEvaluation hand = eval("As Ks Qs Js Ts");
            assertEquals(HandCategory.ROYAL_FLUSH, hand.category());
            assertEquals("Royal Flush", hand.name());
        }

        @Test
        void wheelStraightFlushPlaysFiveHigh() {
            HandEvaluation wheel = eval("Ah 2h 3h 4h 5h");
            assertEquals(HandCategory.STRAIGHT_FLUSH, wheel.category());
            assertEquals(List.of(5), wheel.tieBreaks());

            HandEvaluation sixHigh = eval("2h 3h 4h 5h 6h");
            assertTrue(HandEvaluator.compare(wheel, sixHigh) < 0);
        }

        @Test
        void wheelStraight() {
            HandEvaluation wheel = eval("Ac 2d 3h 4s 5c");
            assertEquals(HandCategory.STRAIGHT, wheel.category());
            assertEquals(List.of(5), wheel.tieBreaks());
        }

        @Test
        void aceHighStraightIsNotAFlush() {
            HandEvaluation hand = eval("Ac Kd Qh Js Tc");
            assertEquals(HandCategory.STRAIGHT, hand.category());
            assertEquals(List.of(14), hand.tieBreaks());
        }

        @Test
        void fourOfAKindCarriesKicker() {
            HandEvaluation hand = eval("9c 9d 9h 9s Kd");
            assertEquals(HandCategory.FOUR_OF_A_KIND, hand.category());
            assertEquals(List.of(9, 13), hand.tieBreaks());
        }

        @Test
        void fullHouseOrdersTripsBeforePair() {
            assertEquals(List.of(7, 2), eval("7c 7d 7h 2s 2c").tieBreaks());

            HandEvaluation twosFull = eval("2c 2d 2h 9s 9d");
            assertEquals(HandCategory.FULL_HOUSE, twosFull.category());
            assertEquals(List.of(2, 9), twosFull.tieBreaks());

            HandEvaluation ninesFull = eval("9c 9d 9h 2s 2d");
            assertEquals(List.of(9, 2), ninesFull.tieBreaks());
            assertTrue(HandEvaluator.compare(twosFull, ninesFull) < 0);
        }

        @Test
        void flushKeepsAllFiveRanks() {
            HandEvaluation hand = eval("Kh 9h 7h 4h 2h");
            assertEquals(HandCategory.FLUSH, hand.category());
            assertEquals(List.of(13, 9, 7, 4, 2), hand.tieBreaks());
        }

        @Test
        void twoPairHighPairFirst() {
            HandEvaluation hand = eval("4c 4d Jh Js 8c");
            assertEquals(HandCategory.TWO_PAIR, hand.category());
            assertEquals(List.of(11, 4, 8), hand.tieBreaks());
        }

        @Test
        void pairThenKickersDescending() {
            HandEvaluation hand = eval("5c 5d Ah 9s 3c");
            assertEquals(HandCategory.PAIR, hand.category());
            assertEquals(List.of(5, 14, 9, 3), hand.tieBreaks());
        }

        @Test
        void threeOfAKind() {
            HandEvaluation hand = eval("Qc Qd Qh 9s 3c");
            assertEquals(HandCategory.THREE_OF_A_KIND, hand.category());
            assertEquals(List.of(12, 9, 3), hand.tieBreaks());
        }
    }

    @Nested
    @DisplayName("Best five of seven")
    class BestOfSeven {

        @Test
        void picksFlushOverStraightOnTheBoard() {
            HandEvaluation hand = eval("2h 7h 8c 9h Th Jd Kh");
            assertEquals(HandCategory.FLUSH, hand.category());
            assertEquals(List.of(13, 10, 9, 7, 2), hand.tieBreaks());
        }

        @Test
        void equalBestHandsFromDifferentSevensTie() {
            HandEvaluation a = eval("As Kd 9c 7h 4s 3d 2c");
            HandEvaluation b = eval("Ac Kh 9d 7s 4c 3h 2d");
            assertEquals(HandCategory.HIGH_CARD, a.category());
            assertEquals(0, HandEvaluator.compare(a, b));
            assertEquals(a, b);
        }

        @Test
        void sixCardsAreAccepted() {
            assertEquals(HandCategory.PAIR, eval("As Ad 9c 7h 4s 2d").category());
        }

        @Test
        void rejectsTooFewOrTooManyCards() {
            assertThrows(IllegalArgumentException.class, () -> eval("As Kd 9c 7h"));
            assertThrows(IllegalArgumentException.class, () -> eval("As Kd 9c 7h 4s 3d 2c 5h"));
        }
    }

    @Nested
    @DisplayName("Ordering properties")
    class Ordering {

        @Test
        void categoryAlwaysDominatesTieBreaks() {
            HandEvaluation bestPair = eval("Ac Ad Kh Qs Jc");
            HandEvaluation worstTwoPair = eval("3c 3d 2h 2s 4c");
            assertTrue(HandEvaluator.compare(worstTwoPair, bestPair) > 0);

            HandEvaluation bestStraight = eval("Ac Kd Qh Js Tc");
            HandEvaluation worstFlush = eval("7h 5h 4h 3h 2h");
            assertTrue(HandEvaluator.compare(worstFlush, bestStraight) > 0);
        }

        @Test
        void compareIsAntisymmetricOnRandomHands() {
            Random random = new Random(7);
            List<Card> deck = new Deck().asUnmodifiableList();
            for (int i = 0; i < 500; i++) {
                List<Card> shuffled = new ArrayList<>(deck);
                Collections.shuffle(shuffled, random);
                HandEvaluation a = HandEvaluator.evaluate(shuffled.subList(0, 7));
                HandEvaluation b = HandEvaluator.evaluate(shuffled.subList(7, 14));
                assertEquals(HandEvaluator.compare(a, b), -HandEvaluator.compare(b, a));
                assertEquals(0, HandEvaluator.compare(a, a));
            }
        }

        @Test
        void sevenCardResultIsAtLeastAnyFiveCardSubset() {
            Random random = new Random(11);
            List<Card> deck = new Deck().asUnmodifiableList();
            for (int i = 0; i < 100; i++) {
                List<Card> shuffled = new ArrayList<>(deck);
                Collections.shuffle(shuffled, random);
                List<Card> seven = shuffled.subList(0, 7);
                HandEvaluation best = HandEvaluator.evaluate(seven);
                for (List<Card> five : HandEvaluator.combinations(seven, 5)) {
                    assertTrue(HandEvaluator.compare(best, HandEvaluator.evaluate5(five)) >= 0);
                }
            }
        }

        @Test
        void combinationsOfSevenChooseFive() {
            assertEquals(21, HandEvaluator.combinations(Cards.of("As Kd 9c 7h 4s 3d 2c"), 5).size());
        }
    }
}

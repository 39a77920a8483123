package ai.holdem.game;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.Test;

/**
 * Deck integrity and card notation.
 */
class DeckTest {

    @Test
    void freshDeckHas52UniqueCards() {
        Deck deck = new Deck();
        assertEquals(52, deck.size());
        Set<Card> seen = new HashSet<>(deck.asUnmodifiableList());
        assertEquals(52, seen.size());
    }

    @Test
    void drawingPastTheLastCardThrows() {
        Deck deck = new Deck();
        for (int i = 0; i < 52; i++) {
            deck.draw();
        }
        assertTrue(deck.isEmpty());
        assertThrows(EmptyDeckException.class, deck::draw);
    }

    @Test
    void resetRestoresAFullDeck() {
        Deck deck = new Deck();
        deck.draw();
        deck.draw();
        deck.reset();
        assertEquals(52, deck.size());
    }

    @Test
    void seededDecksDealTheSameOrder() {
        Deck a = new Deck(new Random(42));
        Deck b = new Deck(new Random(42));
        List<Card> fromA = new ArrayList<>();
        List<Card> fromB = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            fromA.add(a.draw());
            fromB.add(b.draw());
        }
        assertEquals(fromA, fromB);
    }

    @Test
    void stackedDeckDrawsInListedOrder() {
        StackedDeck deck = StackedDeck.of("As Kd 7c");
        assertEquals(52, deck.size());
        assertEquals(Card.parse("As"), deck.draw());
        assertEquals(Card.parse("Kd"), deck.draw());
        assertEquals(Card.parse("7c"), deck.draw());
    }

    @Test
    void parsesLettersSymbolsAndTen() {
        assertEquals(new Card(Rank.ACE, Suit.SPADES), Card.parse("As"));
        assertEquals(new Card(Rank.TEN, Suit.HEARTS), Card.parse("10h"));
        assertEquals(new Card(Rank.TEN, Suit.HEARTS), Card.parse("Th"));
        assertEquals(new Card(Rank.QUEEN, Suit.SPADES), Card.parse("Q♠"));
        assertEquals("Q♠", Card.parse("Qs").shortName());
    }

    @Test
    void rejectsMalformedCards() {
        assertThrows(IllegalArgumentException.class, () -> Card.parse("Xs"));
        assertThrows(IllegalArgumentException.class, () -> Card.parse("Ax"));
        assertThrows(IllegalArgumentException.class, () -> Card.parse("A"));
        assertThrows(IllegalArgumentException.class, () -> Card.parse(null));
    }
}

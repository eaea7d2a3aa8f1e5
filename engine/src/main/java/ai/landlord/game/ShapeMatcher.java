package ai.landlord.game;

/**
 * Recognises one family of hand shapes. Matchers are independent of each other; the
 * {@link HandClassifier} tries them in a fixed order and the first non-null result wins.
 */
@FunctionalInterface
public interface ShapeMatcher {

    /**
     * @param counts rank histogram of the candidate cards (never empty)
     * @return the matched shape, or {@code null} if the cards are not of this family
     */
    HandShape match(CardCounts counts);
}

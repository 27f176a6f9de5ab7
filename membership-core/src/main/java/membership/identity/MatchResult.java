package membership.identity;

import java.util.List;

/**
 * Result of resolving a person against the identity index.
 *
 * <ul>
 *   <li>{@link Unique} - exactly one member row matched.</li>
 *   <li>{@link NoMatch} - nobody matched; the person is new.</li>
 *   <li>{@link Ambiguous} - several rows matched and names did not single one out.</li>
 * </ul>
 */
public sealed interface MatchResult permits MatchResult.Unique, MatchResult.NoMatch, MatchResult.Ambiguous {

  NoMatch NO_MATCH = new NoMatch();

  static Unique unique(int index) {
    return new Unique(index);
  }

  static NoMatch noMatch() {
    return NO_MATCH;
  }

  static Ambiguous ambiguous(List<Integer> candidates) {
    return new Ambiguous(candidates);
  }

  record Unique(int index) implements MatchResult {
  }

  record NoMatch() implements MatchResult {
  }

  /**
   * @param candidates matching row indices in index order, at least two
   */
  record Ambiguous(List<Integer> candidates) implements MatchResult {
    public Ambiguous {
      candidates = List.copyOf(candidates);
      if (candidates.size() < 2) {
        throw new IllegalArgumentException("ambiguous match needs at least two candidates");
      }
    }
  }
}

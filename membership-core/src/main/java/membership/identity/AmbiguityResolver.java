package membership.identity;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Resolves a person to at most one active member row.
 *
 * <p>Email is tried first, then phone. A key that matches exactly one row wins. A key
 * that matches several rows is narrowed by name: if exactly one candidate has the
 * same name key the match is unique, otherwise the result is ambiguous with all
 * candidates of that key. The resolver never guesses between candidates.
 */
public final class AmbiguityResolver {

  public MatchResult resolve(IdentityQuery query, IdentityIndex index) {
    Objects.requireNonNull(query, "query");
    Objects.requireNonNull(index, "index");
    Set<Integer> candidates = index.byEmail(query.email());
    if (candidates.isEmpty()) {
      candidates = index.byPhone(query.phone());
    }
    if (candidates.isEmpty()) {
      return MatchResult.noMatch();
    }
    if (candidates.size() == 1) {
      return MatchResult.unique(candidates.iterator().next());
    }
    return disambiguateByName(query, index, candidates);
  }

  private static MatchResult disambiguateByName(IdentityQuery query, IdentityIndex index,
      Set<Integer> candidates) {
    if (!query.nameKey().isEmpty()) {
      List<Integer> sameName = new ArrayList<>();
      for (Integer candidate : candidates) {
        if (query.nameKey().equals(index.nameKey(candidate))) {
          sameName.add(candidate);
        }
      }
      if (sameName.size() == 1) {
        return MatchResult.unique(sameName.get(0));
      }
    }
    return MatchResult.ambiguous(new ArrayList<>(candidates));
  }
}

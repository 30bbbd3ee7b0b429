package org.calista.grila.crossword.dictionary;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * WordIndex — read-only word lookup shared by the layout engine, the model builder and the validator.
 *
 * <p>Contract:
 * <ul>
 *   <li>surfaces are uppercase A-Z, unique</li>
 *   <li>implementations are immutable once built and safe to share across threads</li>
 *   <li>a pattern is a list of known letters / {@code null} wildcards, sized to the length</li>
 * </ul>
 */
public interface WordIndex {

    /** Ranked entries (score desc, surface asc), banned surfaces removed, capped at {@code query.limit()}. */
    List<DictionaryEntry> findCandidates(CandidateQuery query);

    /** Exactly the surfaces of this length matching every fixed position of the pattern. */
    Set<String> matchingSurfaces(int length, List<Character> pattern);

    boolean hasCandidates(int length, List<Character> pattern, Collection<String> banned);

    /** Cardinality of the match set minus banned surfaces, without materializing entries. */
    int countCandidates(int length, List<Character> pattern, Collection<String> banned);

    boolean contains(String word);

    Optional<DictionaryEntry> get(String word);

    /** Entries whose definition or lemma mention the keyword, ranked by the index difficulty. */
    List<DictionaryEntry> themeCandidates(String keyword, int limit);

    WordNormalizer normalizer();

    Difficulty difficulty();

    int size();

    Set<Integer> lengths();
}

package certflow.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Names sharing one certificate. Names are lower-cased and stripped of a trailing dot; order of first appearance is
 * kept and duplicates are dropped.
 */
public record DomainSet(
    List<String> names
) {

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public DomainSet {
        if (names == null || names.isEmpty()) {
            throw new IllegalArgumentException("A domain set needs at least one name");
        }
        final Set<String> normalized = new LinkedHashSet<>();
        for (String name : names) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Blank name in domain set " + names);
            }
            normalized.add(normalize(name));
        }
        names = List.copyOf(normalized);
    }

    public static DomainSet of(Collection<String> names) {
        return new DomainSet(names == null ? null : List.copyOf(names));
    }

    public static DomainSet of(String... names) {
        return new DomainSet(List.of(names));
    }

    @JsonValue
    @Override
    public List<String> names() {
        return names;
    }

    public String primaryName() {
        return names.get(0);
    }

    public boolean hasWildcard() {
        return names.stream().anyMatch(name -> name.startsWith("*."));
    }

    public int size() {
        return names.size();
    }

    private static String normalize(String name) {
        String result = name.trim().toLowerCase(Locale.ROOT);
        if (result.endsWith(".")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}

package ai.scholar.outline.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Position of a section in the outline, e.g. {@code [2, 1, 3]} for "2.1.3".
 * The length of an address equals the depth of the section it names; the document itself has the empty address.
 */
public record Address(List<Integer> components) {

    private static final Address ROOT = new Address(List.of());

    public Address {
        Objects.requireNonNull(components, "components");
        for (Integer component : components) {
            if (component == null || component < 0) {
                throw new IllegalArgumentException("Address components must be non-negative integers: " + components);
            }
        }
        components = List.copyOf(components);
    }

    public static Address root() {
        return ROOT;
    }

    public static Address of(int... components) {
        List<Integer> values = new ArrayList<>(components.length);
        for (int component : components) {
            values.add(component);
        }
        return new Address(values);
    }

    /**
     * Parses a dotted address such as {@code "2.1.3"}. A single trailing period is tolerated.
     *
     * @return the address, or empty when any component is not a non-negative integer that fits an {@code int}
     */
    public static Optional<Address> parse(String dotted) {
        if (dotted == null) {
            return Optional.empty();
        }
        String value = dotted.trim();
        if (value.endsWith(".")) {
            value = value.substring(0, value.length() - 1);
        }
        if (value.isEmpty()) {
            return Optional.empty();
        }
        String[] parts = value.split("\\.", -1);
        List<Integer> components = new ArrayList<>(parts.length);
        for (String part : parts) {
            if (part.isEmpty() || !part.chars().allMatch(Character::isDigit)) {
                return Optional.empty();
            }
            try {
                components.add(Integer.parseInt(part));
            } catch (NumberFormatException ex) {
                return Optional.empty();
            }
        }
        return Optional.of(new Address(components));
    }

    public int length() {
        return components.size();
    }

    public boolean isRoot() {
        return components.isEmpty();
    }

    public int get(int index) {
        return components.get(index);
    }

    public int last() {
        if (components.isEmpty()) {
            throw new IllegalStateException("The root address has no components");
        }
        return components.get(components.size() - 1);
    }

    public Address child(int component) {
        List<Integer> values = new ArrayList<>(components);
        values.add(component);
        return new Address(values);
    }

    public Address prefix(int length) {
        if (length < 0 || length > components.size()) {
            throw new IllegalArgumentException("Invalid prefix length " + length + " for " + this);
        }
        return new Address(components.subList(0, length));
    }

    public boolean isProperPrefixOf(Address other) {
        return components.size() < other.components.size()
                && other.components.subList(0, components.size()).equals(components);
    }

    /**
     * Index of the first component where the two addresses differ, limited to their common length.
     * Returns {@code -1} when one address is a prefix of the other.
     */
    public int firstDifference(Address other) {
        int common = Math.min(components.size(), other.components.size());
        for (int i = 0; i < common; i++) {
            if (!components.get(i).equals(other.components.get(i))) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public String toString() {
        return components.stream().map(String::valueOf).collect(Collectors.joining("."));
    }
}

package org.pagemark.cfi;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable CFI path: one or more indirection groups separated by {@code !}.
 *
 * <p>Every group holds at least one step. Only the last step of the last group may carry
 * terminal data.</p>
 *
 * @param groups indirection groups in order.
 */
public record CfiPath(List<List<CfiStep>> groups) {

    /**
     * Validates and deep-copies the group structure.
     */
    public CfiPath {
        Objects.requireNonNull(groups, "groups");
        if (groups.isEmpty()) {
            throw new IllegalArgumentException("path must contain at least one group");
        }
        List<List<CfiStep>> copy = new ArrayList<>(groups.size());
        for (int g = 0; g < groups.size(); g++) {
            List<CfiStep> group = Objects.requireNonNull(groups.get(g), "group");
            if (group.isEmpty()) {
                throw new IllegalArgumentException("group " + g + " must contain at least one step");
            }
            for (int i = 0; i < group.size(); i++) {
                CfiStep step = Objects.requireNonNull(group.get(i), "step");
                boolean terminal = g == groups.size() - 1 && i == group.size() - 1;
                if (!terminal && step.hasTerminal()) {
                    throw new IllegalArgumentException("terminal data is only allowed on the last step");
                }
            }
            copy.add(List.copyOf(group));
        }
        groups = List.copyOf(copy);
    }

    /**
     * Creates a single-group path.
     */
    public static CfiPath of(CfiStep... steps) {
        return new CfiPath(List.of(List.of(steps)));
    }

    /**
     * Creates a single-group path of bare indices.
     */
    public static CfiPath ofIndices(int... indices) {
        List<CfiStep> steps = new ArrayList<>(indices.length);
        for (int index : indices) {
            steps.add(CfiStep.of(index));
        }
        return new CfiPath(List.of(steps));
    }

    /**
     * Returns number of indirection groups.
     */
    public int groupCount() {
        return groups.size();
    }

    /**
     * Returns one indirection group.
     */
    public List<CfiStep> group(int groupIndex) {
        return groups.get(groupIndex);
    }

    /**
     * Returns total number of steps across all groups.
     */
    public int stepCount() {
        int count = 0;
        for (List<CfiStep> group : groups) {
            count += group.size();
        }
        return count;
    }

    /**
     * Returns the first step of the first group.
     */
    public CfiStep firstStep() {
        return groups.get(0).get(0);
    }

    /**
     * Returns the last step of the last group.
     */
    public CfiStep lastStep() {
        List<CfiStep> last = groups.get(groups.size() - 1);
        return last.get(last.size() - 1);
    }

    /**
     * Joins a suffix onto this path.
     *
     * <p>The first group of {@code suffix} continues this path's last group; later suffix groups
     * follow as new indirection groups.</p>
     */
    public CfiPath append(CfiPath suffix) {
        Objects.requireNonNull(suffix, "suffix");
        List<List<CfiStep>> joined = new ArrayList<>(groups.size() + suffix.groups.size() - 1);
        for (int g = 0; g < groups.size() - 1; g++) {
            joined.add(groups.get(g));
        }
        List<CfiStep> bridge = new ArrayList<>(groups.get(groups.size() - 1));
        bridge.addAll(suffix.groups.get(0));
        joined.add(bridge);
        for (int g = 1; g < suffix.groups.size(); g++) {
            joined.add(suffix.groups.get(g));
        }
        return new CfiPath(joined);
    }

    @Override
    public String toString() {
        return CfiFormatter.format(this);
    }
}

package io.hearthwarrio.formweaver.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Nesting path of a control through frames.
 * <p>
 * The path holds frame indexes starting from the top document; {@link #TOP} has an empty path.
 */
public final class FrameContext {

    public static final FrameContext TOP = new FrameContext(List.of());

    private final List<Integer> path;

    private FrameContext(List<Integer> path) {
        this.path = List.copyOf(path);
    }

    public static FrameContext of(List<Integer> path) {
        Objects.requireNonNull(path, "path must not be null");
        return path.isEmpty() ? TOP : new FrameContext(path);
    }

    public FrameContext child(int index) {
        List<Integer> next = new ArrayList<>(path);
        next.add(index);
        return new FrameContext(next);
    }

    public List<Integer> getPath() {
        return path;
    }

    public int getDepth() {
        return path.size();
    }

    public boolean isTop() {
        return path.isEmpty();
    }

    /**
     * Readable form used in logs, e.g. {@code iframe[0]->iframe[2]}.
     */
    public String describe() {
        if (path.isEmpty()) {
            return "top";
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < path.size(); i++) {
            if (i > 0) {
                sb.append("->");
            }
            sb.append("iframe[").append(path.get(i)).append(']');
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof FrameContext other && path.equals(other.path);
    }

    @Override
    public int hashCode() {
        return path.hashCode();
    }

    @Override
    public String toString() {
        return describe();
    }
}

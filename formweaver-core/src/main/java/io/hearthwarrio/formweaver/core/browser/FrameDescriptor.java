package io.hearthwarrio.formweaver.core.browser;

/**
 * A child frame of the current document, as reported by the probe.
 */
public final class FrameDescriptor {

    private final int index;
    private final String source;
    private final int width;
    private final int height;

    public FrameDescriptor(int index, String source, int width, int height) {
        this.index = index;
        this.source = source == null ? "" : source;
        this.width = width;
        this.height = height;
    }

    public int getIndex() {
        return index;
    }

    /**
     * Frame address ({@code src}), or an empty string for inline frames.
     */
    public String getSource() {
        return source;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    @Override
    public String toString() {
        return "FrameDescriptor{index=" + index + ", src='" + source + "', " + width + "x" + height + '}';
    }
}

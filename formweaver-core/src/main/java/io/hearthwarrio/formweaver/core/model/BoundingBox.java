package io.hearthwarrio.formweaver.core.model;

public final class BoundingBox {

    private final int x;
    private final int y;
    private final int width;
    private final int height;

    public BoundingBox(int x, int y, int width, int height) {
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    public int getX() {
        return x;
    }

    public int getY() {
        return y;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public boolean isEmpty() {
        return width <= 0 || height <= 0;
    }

    @Override
    public String toString() {
        return "BoundingBox{" + x + "," + y + " " + width + "x" + height + '}';
    }
}

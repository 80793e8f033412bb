package com.ttennebkram.imagerouter.model;

import com.ttennebkram.imagerouter.exceptions.BadArgumentException;

/**
 * Crop rectangle given as (left, top, right, bottom) edges, right and bottom exclusive.
 * {@link #clampTo(int, int)} validates it against an image and returns the
 * region that actually lies inside the image.
 */
public final class CropRect {

    private final int left;
    private final int top;
    private final int right;
    private final int bottom;

    public CropRect(int left, int top, int right, int bottom) {
        this.left = left;
        this.top = top;
        this.right = right;
        this.bottom = bottom;
    }

    public int getLeft() {
        return left;
    }

    public int getTop() {
        return top;
    }

    public int getRight() {
        return right;
    }

    public int getBottom() {
        return bottom;
    }

    public int getWidth() {
        return right - left;
    }

    public int getHeight() {
        return bottom - top;
    }

    /**
     * Clamp this rectangle to an image of the given size.
     *
     * @return a rectangle fully inside the image with positive width and height
     * @throws BadArgumentException if the rectangle is empty or entirely outside the image
     */
    public CropRect clampTo(int imageWidth, int imageHeight) throws BadArgumentException {
        if (left >= right
                || left >= imageWidth
                || right <= 0
                || top >= bottom
                || top >= imageHeight
                || bottom <= 0) {
            throw new BadArgumentException("Invalid crop dimensions: " + this
                + " for image " + imageWidth + "x" + imageHeight);
        }
        return new CropRect(
            Math.max(0, left),
            Math.max(0, top),
            Math.min(right, imageWidth),
            Math.min(bottom, imageHeight));
    }

    @Override
    public String toString() {
        return "(" + left + ", " + top + ", " + right + ", " + bottom + ")";
    }
}

package com.ttennebkram.imagerouter.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

/**
 * Tests for {@link ImageFormat} and {@link StandardRepresentations}.
 */
class ImageFormatTest {

    @Test
    @DisplayName("formats resolve from file names")
    void fromFileName() {
        assertEquals(ImageFormat.JPEG, ImageFormat.fromFileName("photo.JPG"));
        assertEquals(ImageFormat.JPEG, ImageFormat.fromFileName("photo.jpeg"));
        assertEquals(ImageFormat.TIFF, ImageFormat.fromFileName("scan.tif"));
        assertEquals(ImageFormat.WEBP, ImageFormat.fromExtension(".webp"));
        assertNull(ImageFormat.fromFileName("notes.txt"));
        assertNull(ImageFormat.fromFileName("README"));
    }

    @Test
    @DisplayName("save operation names follow the format name")
    void saveOperation() {
        assertEquals(OperationNames.SAVE_AS_JPEG, ImageFormat.JPEG.getSaveOperation());
        assertEquals(OperationNames.SAVE_AS_WEBP, ImageFormat.WEBP.getSaveOperation());
    }

    @Test
    @DisplayName("every format has its own file representation")
    void fileRepresentations() {
        assertSame(StandardRepresentations.PNG_FILE, StandardRepresentations.forFormat(ImageFormat.PNG));
        assertEquals("png-file", StandardRepresentations.PNG_FILE.getName());
        for (ImageFormat format : ImageFormat.values()) {
            assertEquals(format.getFormatName() + "-file", StandardRepresentations.forFormat(format).getName());
        }
    }
}

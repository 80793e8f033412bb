package com.ttennebkram.imagerouter.backends.awt;

import com.ttennebkram.imagerouter.ImageRouter;
import com.ttennebkram.imagerouter.TestImages;
import com.ttennebkram.imagerouter.config.RouterConfig;
import com.ttennebkram.imagerouter.exceptions.BadArgumentException;
import com.ttennebkram.imagerouter.exceptions.UnsupportedImageOperationException;
import com.ttennebkram.imagerouter.model.ImageFormat;
import com.ttennebkram.imagerouter.model.ImageSize;
import com.ttennebkram.imagerouter.model.RgbImageBuffer;
import com.ttennebkram.imagerouter.model.StandardRepresentations;
import com.ttennebkram.imagerouter.processing.Session;
import com.ttennebkram.imagerouter.registry.CapabilityRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link AwtBackend} through sessions on a router with only this backend.
 */
class AwtBackendTest {

    private ImageRouter router;

    @BeforeEach
    void setUp() {
        router = new ImageRouter(new CapabilityRegistry(), RouterConfig.defaults());
        assertTrue(router.install(new AwtBackend()));
    }

    @Nested
    @DisplayName("Decoding and inspection")
    class Inspection {

        @Test
        @DisplayName("size query decodes the file into an AWT image")
        void getSize() throws Exception {
            Session session = router.open(TestImages.png(4, 3));
            assertSame(StandardRepresentations.PNG_FILE, session.getRepresentation());

            assertEquals(new ImageSize(4, 3), session.getSize());
            assertSame(AwtBackend.AWT_IMAGE, session.getRepresentation());
        }

        @Test
        @DisplayName("alpha is reported from the colour model")
        void hasAlpha() throws Exception {
            assertFalse(router.open(TestImages.png(2, 2)).hasAlpha());
            assertTrue(router.open(TestImages.encode(TestImages.transparent(2, 2), "png")).hasAlpha());
        }

        @Test
        @DisplayName("GIF frames are counted without decoding")
        void gifFrameCount() throws Exception {
            Session session = router.open(TestImages.encode(TestImages.opaque(3, 3), "gif"));

            assertEquals(1, session.getFrameCount());
            assertFalse(session.hasAnimation());
            assertSame(StandardRepresentations.GIF_FILE, session.getRepresentation());
        }

        @Test
        @DisplayName("decoded images have one frame")
        void decodedFrameCount() throws Exception {
            Session session = router.wrap(AwtBackend.AWT_IMAGE, TestImages.opaque(2, 2));

            assertEquals(1, session.getFrameCount());
        }

        @Test
        @DisplayName("pixel buffer keeps the alpha channel")
        void pixelBuffer() throws Exception {
            Session session = router.wrap(AwtBackend.AWT_IMAGE, TestImages.transparent(2, 1));

            RgbImageBuffer buffer = session.convertTo(StandardRepresentations.PIXEL_BUFFER);

            assertTrue(buffer.hasAlpha());
            byte[] data = buffer.getData();
            assertEquals(8, data.length);
            assertEquals(0, data[0]);
            assertEquals((byte) 0xFF, data[1]);
            assertEquals((byte) 0xFF, data[3]);
            assertEquals(0, data[7]);

            BufferedImage back = session.convertTo(AwtBackend.AWT_IMAGE);
            assertEquals(0xFF00FF00, back.getRGB(0, 0));
        }
    }

    @Nested
    @DisplayName("Transformations")
    class Transformations {

        @Test
        @DisplayName("resize produces a new session of the requested size")
        void resize() throws Exception {
            Session session = router.open(TestImages.png(8, 6));

            Session resized = session.resize(4, 2);

            assertSame(AwtBackend.AWT_IMAGE, resized.getRepresentation());
            assertEquals(new ImageSize(4, 2), resized.getSize());
            assertEquals(new ImageSize(8, 6), session.getSize());
        }

        @Test
        @DisplayName("non-positive resize is a bad argument")
        void resizeInvalid() throws Exception {
            Session session = router.open(TestImages.png(8, 6));

            assertThrows(BadArgumentException.class, () -> session.resize(0, 5));
        }

        @Test
        @DisplayName("crop clamps to the image")
        void cropClamps() throws Exception {
            Session session = router.open(TestImages.png(10, 10));

            Session cropped = session.crop(-5, -5, 3, 4);

            assertEquals(new ImageSize(3, 4), cropped.getSize());
            BufferedImage pixels = cropped.getValue(AwtBackend.AWT_IMAGE);
            assertEquals(Color.RED.getRGB(), pixels.getRGB(0, 0));
        }

        @Test
        @DisplayName("crop outside the image is a bad argument")
        void cropOutside() throws Exception {
            Session session = router.open(TestImages.png(10, 10));

            assertThrows(BadArgumentException.class, () -> session.crop(20, 0, 30, 5));
            assertThrows(BadArgumentException.class, () -> session.crop(5, 5, 5, 8));
        }

        @Test
        @DisplayName("quarter turns rotate clockwise")
        void rotateQuarterTurns() throws Exception {
            Session session = router.wrap(AwtBackend.AWT_IMAGE, TestImages.opaque(4, 2));

            Session quarter = session.rotate(90);
            assertEquals(new ImageSize(2, 4), quarter.getSize());
            assertEquals(Color.RED.getRGB(), quarter.getValue(AwtBackend.AWT_IMAGE).getRGB(1, 0));

            Session half = session.rotate(180);
            assertEquals(Color.RED.getRGB(), half.getValue(AwtBackend.AWT_IMAGE).getRGB(3, 1));

            Session anticlockwise = session.rotate(-90);
            assertEquals(Color.RED.getRGB(), anticlockwise.getValue(AwtBackend.AWT_IMAGE).getRGB(0, 3));
        }

        @Test
        @DisplayName("other angles are rejected")
        void rotateArbitrary() {
            Session session = router.wrap(AwtBackend.AWT_IMAGE, TestImages.opaque(4, 2));

            assertThrows(BadArgumentException.class, () -> session.rotate(45));
        }

        @Test
        @DisplayName("background colour fills transparent pixels")
        void backgroundColor() throws Exception {
            Session session = router.wrap(AwtBackend.AWT_IMAGE, TestImages.transparent(2, 2));

            Session flat = session.setBackgroundColorRgb(255, 0, 0);

            assertFalse(flat.hasAlpha());
            BufferedImage pixels = flat.getValue(AwtBackend.AWT_IMAGE);
            assertEquals(0xFF00FF00, pixels.getRGB(0, 0));
            assertEquals(0xFFFF0000, pixels.getRGB(1, 1));
        }

        @Test
        @DisplayName("background colour on an opaque image is a no-op copy")
        void backgroundColorOpaque() throws Exception {
            BufferedImage original = TestImages.opaque(2, 2);
            Session session = router.wrap(AwtBackend.AWT_IMAGE, original);

            BufferedImage result = session.setBackgroundColorRgb(0, 255, 0).getValue(AwtBackend.AWT_IMAGE);

            assertNotSame(original, result);
            assertEquals(original.getRGB(1, 1), result.getRGB(1, 1));
        }

        @Test
        @DisplayName("colour channels outside 0-255 are rejected")
        void backgroundColorInvalid() {
            Session session = router.wrap(AwtBackend.AWT_IMAGE, TestImages.transparent(2, 2));

            assertThrows(BadArgumentException.class, () -> session.setBackgroundColorRgb(256, 0, 0));
        }
    }

    @Nested
    @DisplayName("Encoding")
    class Encoding {

        @Test
        @DisplayName("save writes the file and returns it as a new session")
        void saveAsJpeg() throws Exception {
            Session session = router.open(TestImages.png(6, 4));
            ByteArrayOutputStream out = new ByteArrayOutputStream();

            Session saved = session.saveAsJpeg(out);

            byte[] bytes = out.toByteArray();
            assertEquals((byte) 0xFF, bytes[0]);
            assertEquals((byte) 0xD8, bytes[1]);
            assertSame(StandardRepresentations.JPEG_FILE, saved.getRepresentation());
            assertEquals(new ImageSize(6, 4), saved.getSize());
        }

        @Test
        @DisplayName("JPEG accepts quality and progressive flags")
        void saveAsJpegWithQuality() throws Exception {
            Session session = router.wrap(AwtBackend.AWT_IMAGE, TestImages.transparent(8, 8));
            ByteArrayOutputStream out = new ByteArrayOutputStream();

            session.saveAsJpeg(out, 40, true);

            assertEquals(8, TestImages.decode(out.toByteArray()).getWidth());
            assertThrows(BadArgumentException.class,
                () -> session.saveAsJpeg(new ByteArrayOutputStream(), 0, false));
        }

        @Test
        @DisplayName("every ImageIO format round-trips through its save operation")
        void saveFormats() throws Exception {
            for (ImageFormat format : new ImageFormat[]{ImageFormat.PNG, ImageFormat.GIF, ImageFormat.BMP,
                ImageFormat.TIFF}) {
                Session session = router.open(TestImages.png(5, 3));
                ByteArrayOutputStream out = new ByteArrayOutputStream();

                Session saved = session.saveAs(format, out);

                assertSame(StandardRepresentations.forFormat(format), saved.getRepresentation(), format.name());
                assertEquals(new ImageSize(5, 3), router.open(out.toByteArray()).getSize(), format.name());
            }
        }

        @Test
        @DisplayName("WEBP is not available from this backend alone")
        void webpUnsupported() throws Exception {
            Session session = router.open(TestImages.png(2, 2));

            assertThrows(UnsupportedImageOperationException.class,
                () -> session.saveAsWebp(new ByteArrayOutputStream()));
            assertSame(StandardRepresentations.PNG_FILE, session.getRepresentation());
        }
    }
}

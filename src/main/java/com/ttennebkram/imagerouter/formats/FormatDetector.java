package com.ttennebkram.imagerouter.formats;

import com.ttennebkram.imagerouter.exceptions.UnrecognizedFormatException;
import com.ttennebkram.imagerouter.model.EncodedImage;
import com.ttennebkram.imagerouter.model.ImageFormat;
import com.ttennebkram.imagerouter.model.ImageValue;
import com.ttennebkram.imagerouter.model.StandardRepresentations;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Set;

/**
 * Identifies encoded image bytes by their magic numbers and wraps them in the
 * matching file representation. Nothing is decoded here; backends do that
 * through their converters.
 */
public class FormatDetector {

    private static final byte[] PNG_SIGNATURE = {
        (byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1A, '\n'
    };

    private static final Set<String> AVIF_BRANDS = Set.of("avif", "avis");
    private static final Set<String> HEIC_BRANDS = Set.of("heic", "heix", "hevc", "hevx", "heim", "heis", "mif1", "msf1");

    // How far into a text document to look for the <svg> root
    private static final int SVG_SCAN_LIMIT = 1024;

    /**
     * Detect the format of encoded image bytes.
     *
     * @throws UnrecognizedFormatException if the bytes match no known format
     */
    public ImageFormat detect(byte[] data) throws UnrecognizedFormatException {
        if (data == null || data.length == 0) {
            throw new UnrecognizedFormatException("Empty input");
        }
        if (startsWith(data, 0, (byte) 0xFF, (byte) 0xD8, (byte) 0xFF)) {
            return ImageFormat.JPEG;
        }
        if (startsWith(data, 0, PNG_SIGNATURE)) {
            return ImageFormat.PNG;
        }
        if (startsWithAscii(data, 0, "GIF87a") || startsWithAscii(data, 0, "GIF89a")) {
            return ImageFormat.GIF;
        }
        if (startsWithAscii(data, 0, "II*\0") || startsWithAscii(data, 0, "MM\0*")) {
            return ImageFormat.TIFF;
        }
        if (startsWithAscii(data, 0, "RIFF") && startsWithAscii(data, 8, "WEBP")) {
            return ImageFormat.WEBP;
        }
        if (startsWithAscii(data, 4, "ftyp")) {
            ImageFormat isoFormat = detectIsoMedia(data);
            if (isoFormat != null) {
                return isoFormat;
            }
        }
        if (startsWith(data, 0, (byte) 0x00, (byte) 0x00, (byte) 0x01, (byte) 0x00) && data.length >= 6) {
            return ImageFormat.ICO;
        }
        if (startsWithAscii(data, 0, "BM") && data.length >= 14) {
            return ImageFormat.BMP;
        }
        if (looksLikeSvg(data)) {
            return ImageFormat.SVG;
        }
        throw new UnrecognizedFormatException("Unrecognized image format (" + data.length + " bytes, starts with "
            + hexPrefix(data) + ")");
    }

    /**
     * Detect the format and wrap the bytes in its file representation.
     */
    public ImageValue<EncodedImage> decode(byte[] data) throws UnrecognizedFormatException {
        ImageFormat format = detect(data);
        return StandardRepresentations.encoded(format, data);
    }

    /**
     * ISO base media file ("ftyp" box): major brand first, then compatible brands.
     */
    private static ImageFormat detectIsoMedia(byte[] data) {
        if (data.length < 12) return null;
        int boxSize = ((data[0] & 0xFF) << 24) | ((data[1] & 0xFF) << 16) | ((data[2] & 0xFF) << 8) | (data[3] & 0xFF);
        int end = Math.min(data.length, Math.max(boxSize, 12));

        String majorBrand = ascii(data, 8, 4);
        if (AVIF_BRANDS.contains(majorBrand)) return ImageFormat.AVIF;
        if (HEIC_BRANDS.contains(majorBrand)) {
            // mif1 files may still be AVIF; check compatible brands first
            for (int offset = 16; offset + 4 <= end; offset += 4) {
                if (AVIF_BRANDS.contains(ascii(data, offset, 4))) {
                    return ImageFormat.AVIF;
                }
            }
            return ImageFormat.HEIC;
        }
        for (int offset = 16; offset + 4 <= end; offset += 4) {
            String brand = ascii(data, offset, 4);
            if (AVIF_BRANDS.contains(brand)) return ImageFormat.AVIF;
            if (HEIC_BRANDS.contains(brand)) return ImageFormat.HEIC;
        }
        return null;
    }

    private static boolean looksLikeSvg(byte[] data) {
        int length = Math.min(data.length, SVG_SCAN_LIMIT);
        String head = new String(data, 0, length, StandardCharsets.UTF_8);
        if (head.startsWith("\uFEFF")) {
            head = head.substring(1);
        }
        head = head.stripLeading();
        if (!head.startsWith("<")) {
            return false;
        }
        return head.toLowerCase(Locale.ROOT).contains("<svg");
    }

    private static boolean startsWith(byte[] data, int offset, byte... prefix) {
        if (data.length < offset + prefix.length) return false;
        for (int i = 0; i < prefix.length; i++) {
            if (data[offset + i] != prefix[i]) return false;
        }
        return true;
    }

    private static boolean startsWithAscii(byte[] data, int offset, String prefix) {
        return startsWith(data, offset, prefix.getBytes(StandardCharsets.ISO_8859_1));
    }

    private static String ascii(byte[] data, int offset, int length) {
        return new String(data, offset, length, StandardCharsets.ISO_8859_1);
    }

    private static String hexPrefix(byte[] data) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < Math.min(8, data.length); i++) {
            sb.append(String.format("%02x", data[i] & 0xFF));
        }
        return sb.toString();
    }
}

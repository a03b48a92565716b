package com.sgw.worker.client;

import com.google.zxing.BarcodeFormat;
import com.google.zxing.EncodeHintType;
import com.google.zxing.WriterException;
import com.google.zxing.client.j2se.MatrixToImageWriter;
import com.google.zxing.common.BitMatrix;
import com.google.zxing.qrcode.QRCodeWriter;
import com.google.zxing.qrcode.decoder.ErrorCorrectionLevel;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.EnumMap;
import java.util.Map;

/**
 * Renders the pairing code as a scannable QR image, {@code data:image/png;base64,...},
 * ready to drop into an {@code <img src>}.
 */
public final class QrDataUrlRenderer implements PairingCodeRenderer {

    static final String PREFIX = "data:image/png;base64,";

    private final int size;
    private final Map<EncodeHintType, Object> hints = new EnumMap<>(EncodeHintType.class);

    public QrDataUrlRenderer(int size) {
        if (size < 21) throw new IllegalArgumentException("qrImageSize too small: " + size);
        this.size = size;
        hints.put(EncodeHintType.ERROR_CORRECTION, ErrorCorrectionLevel.M);
        hints.put(EncodeHintType.CHARACTER_SET, StandardCharsets.UTF_8.name());
        hints.put(EncodeHintType.MARGIN, 4);
    }

    @Override
    public String render(String code) {
        BitMatrix matrix;
        try {
            matrix = new QRCodeWriter().encode(code, BarcodeFormat.QR_CODE, size, size, hints);
        } catch (WriterException e) {
            throw new IllegalArgumentException("pairing code cannot be encoded as QR: " + e.getMessage(), e);
        }
        ByteArrayOutputStream png = new ByteArrayOutputStream();
        try {
            MatrixToImageWriter.writeToStream(matrix, "PNG", png);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return PREFIX + Base64.getEncoder().encodeToString(png.toByteArray());
    }
}

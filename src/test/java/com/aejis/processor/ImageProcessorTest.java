package com.aejis.processor;

import com.aejis.core.model.ProcessingResult;
import com.aejis.core.scoring.ScoringAggregator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class ImageProcessorTest {

    private final ImageProcessor processor = new ImageProcessor();
    private final ScoringAggregator scoring = new ScoringAggregator();

    private static byte[] png(int width, int height) throws IOException {
        var image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        var g = image.createGraphics();
        g.setColor(Color.ORANGE);
        g.fillRect(0, 0, width, height);
        g.dispose();
        var out = new ByteArrayOutputStream();
        ImageIO.write(image, "png", out);
        return out.toByteArray();
    }

    @Test
    @DisplayName("a small PNG yields dimensions, a thumbnail and a clean score")
    void smallPng() throws IOException {
        ProcessingResult result = processor.process(new Artifact(png(50, 50), ".png", "image/png"),
                ProcessingContext.preview());

        assertTrue(result.success());
        assertEquals("image", result.previewType());
        assertEquals("50x50", result.metadata().get("dimensions"));
        assertEquals("PNG", result.metadata().get("format"));
        assertNotNull(result.thumbnail());
        assertTrue(result.thumbnail().startsWith("data:image/png;base64,"));
        assertEquals(100, scoring.rescore(result).behavioralScore());
    }

    @Test
    void appendedExecutableIsReported() throws IOException {
        byte[] image = png(8, 8);
        byte[] tail = {'M', 'Z', (byte) 0x90, 0, 3, 0, 0, 0};
        byte[] data = new byte[image.length + tail.length];
        System.arraycopy(image, 0, data, 0, image.length);
        System.arraycopy(tail, 0, data, image.length, tail.length);

        ProcessingResult result = processor.process(new Artifact(data, ".png", null), ProcessingContext.preview());

        assertTrue(result.threatIndicators().contains("EXECUTABLE_CONTENT: executable appended after image data"));
        assertEquals((long) tail.length, result.metadata().get("trailing_bytes"));
    }

    @Test
    void undecodableImageFails() throws IOException {
        ProcessingResult result = processor.process(new Artifact("not an image".getBytes(), ".png", null),
                ProcessingContext.preview());

        assertFalse(result.success());
        assertEquals("UNSUPPORTED_FORMAT", result.errorCode());
    }
}

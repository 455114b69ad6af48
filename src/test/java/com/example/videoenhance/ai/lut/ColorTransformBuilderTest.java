package com.example.videoenhance.ai.lut;

import com.example.videoenhance.model.Frame;
import com.example.videoenhance.testsupport.TestFrames;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ColorTransformBuilderTest {

    // 18 nodes per axis puts grid levels on multiples of 15, so test colors sit exactly on nodes
    private static final int GRID = 18;

    private final ColorTransformBuilder builder = new ColorTransformBuilder();

    @Test
    public void testBuild_UnchangedFrame_ReturnsIdentity() {
        // Given
        Frame frame = TestFrames.gradient(0, 64, 8);

        // When
        ColorTransform transform = builder.build(frame, frame);

        // Then
        assertTrue(transform.isIdentity());
        assertEquals(ColorTransform.DEFAULT_SIZE, transform.getSize());
    }

    @Test
    public void testBuild_ObservedNode_CarriesMeanOffset() {
        // Given
        Frame before = TestFrames.solid(0, TestFrames.rgb(105, 150, 45));
        Frame after = TestFrames.solid(0, TestFrames.rgb(135, 150, 30));

        // When
        ColorTransform transform = builder.build(before, after, GRID);

        // Then: node (7, 10, 3) holds the edited color
        assertEquals(135f, transform.output(7, 10, 3, 0), 1e-3);
        assertEquals(150f, transform.output(7, 10, 3, 1), 1e-3);
        assertEquals(30f, transform.output(7, 10, 3, 2), 1e-3);
        assertFalse(transform.isIdentity());
    }

    @Test
    public void testBuild_UnobservedNodes_KeepIdentity() {
        Frame before = TestFrames.solid(0, TestFrames.rgb(105, 150, 45));
        Frame after = TestFrames.solid(0, TestFrames.rgb(135, 150, 30));

        ColorTransform transform = builder.build(before, after, GRID);

        assertEquals(240f, transform.output(16, 1, 1, 0), 1e-3);
        assertEquals(15f, transform.output(16, 1, 1, 1), 1e-3);
        assertEquals(15f, transform.output(16, 1, 1, 2), 1e-3);
    }

    @Test
    public void testBuild_OffsetPastWhite_ClampsOutput() {
        // Given: 250 lies between nodes 16 and 17; the +5 offset would push the top node past 255
        Frame before = TestFrames.solid(0, TestFrames.rgb(250, 250, 250));
        Frame after = TestFrames.solid(0, TestFrames.rgb(255, 255, 255));

        // When
        ColorTransform transform = builder.build(before, after, GRID);

        // Then
        assertEquals(255f, transform.output(17, 17, 17, 0), 1e-3);
        assertEquals(255f, transform.output(17, 17, 17, 2), 1e-3);
        assertEquals(245f, transform.output(16, 16, 16, 0), 1e-3);
    }

    @Test
    public void testBuild_OffNodeColorAtDefaultSize_AppliesBackToEditedColor() {
        // Given: 128 falls between grid nodes at size 32
        Frame before = TestFrames.solid(0, TestFrames.rgb(128, 128, 128));
        Frame after = TestFrames.solid(0, TestFrames.rgb(158, 158, 158));

        // When
        ColorTransform transform = builder.build(before, after);
        Frame applied = new TransformPropagator().apply(transform, before);

        // Then
        int rgb = applied.getRgb(0);
        assertEquals(158, (rgb >> 16) & 0xFF, 2);
        assertEquals(158, (rgb >> 8) & 0xFF, 2);
        assertEquals(158, rgb & 0xFF, 2);
    }

    @Test
    public void testBuild_MixedColors_EachMapsNearItsOwnEdit() {
        // Given: half the frame warm-shifted, the other half untouched
        Frame before = TestFrames.solid(0, 8, 8, TestFrames.rgb(200, 60, 60));
        int[] beforePixels = before.copyPixels();
        int[] afterPixels = new int[beforePixels.length];
        for (int i = 0; i < beforePixels.length; i++) {
            if (i < beforePixels.length / 2) {
                beforePixels[i] = TestFrames.rgb(40, 90, 170);
                afterPixels[i] = TestFrames.rgb(40, 90, 170);
            } else {
                afterPixels[i] = TestFrames.rgb(220, 70, 50);
            }
        }
        Frame mixedBefore = before.withPixels(8, 8, beforePixels);
        Frame mixedAfter = before.withPixels(8, 8, afterPixels);

        // When
        Frame applied = new TransformPropagator().apply(builder.build(mixedBefore, mixedAfter), mixedBefore);

        // Then
        assertEquals(TestFrames.rgb(40, 90, 170), applied.getRgb(0));
        int warm = applied.getRgb(beforePixels.length - 1);
        assertEquals(220, (warm >> 16) & 0xFF, 2);
        assertEquals(70, (warm >> 8) & 0xFF, 2);
        assertEquals(50, warm & 0xFF, 2);
    }

    @Test
    public void testBuild_DifferentGeometry_ThrowsGeometryMismatch() {
        Frame before = TestFrames.solid(0, 8, 8, 0x808080);
        Frame after = TestFrames.solid(0, 16, 16, 0x808080);

        GeometryMismatchException e = assertThrows(GeometryMismatchException.class,
            () -> builder.build(before, after));
        assertTrue(e.getMessage().contains("8x8"));
    }

    @Test
    public void testBuild_InvalidSize_Throws() {
        Frame frame = TestFrames.solid(0, 0x808080);

        assertThrows(IllegalArgumentException.class, () -> builder.build(frame, frame, 1));
    }

    @Test
    public void testToCubeFormat_IdentityOfSizeTwo_RedVariesFastest() {
        // When
        String cube = ColorTransform.identity(2).toCubeFormat("identity");

        // Then
        String[] lines = cube.split("\n");
        assertEquals("TITLE \"identity\"", lines[0]);
        assertEquals("LUT_3D_SIZE 2", lines[1]);
        assertEquals("0.000000 0.000000 0.000000", lines[3].trim());
        assertEquals("1.000000 0.000000 0.000000", lines[4].trim());
        assertEquals("0.000000 1.000000 0.000000", lines[5].trim());
        assertEquals("1.000000 1.000000 1.000000", lines[10].trim());
    }
}

package com.example.videoenhance.ai.lut;

import com.example.videoenhance.model.Frame;
import com.example.videoenhance.model.FrameGroup;
import com.example.videoenhance.testsupport.TestFrames;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TransformPropagatorTest {

    private final ColorTransformBuilder builder = new ColorTransformBuilder();
    private final TransformPropagator propagator = new TransformPropagator();

    @Test
    public void testApply_Identity_ReturnsSamePixels() {
        // Given
        Frame frame = TestFrames.gradient(3, 256, 4);

        // When
        Frame result = propagator.apply(ColorTransform.identity(32), frame);

        // Then
        assertTrue(result.samePixels(frame), "Identity transform must not change any pixel");
        assertEquals(3, result.getIndex());
    }

    @Test
    public void testApply_IdentityTwice_IsIdempotent() {
        Frame frame = TestFrames.gradient(0, 97, 3);
        ColorTransform identity = ColorTransform.identity(17);

        Frame once = propagator.apply(identity, frame);
        Frame twice = propagator.apply(identity, once);

        assertTrue(twice.samePixels(once));
    }

    @Test
    public void testApply_NodeAlignedColor_ReproducesEdit() {
        // Given
        Frame before = TestFrames.solid(0, TestFrames.rgb(105, 150, 45));
        Frame after = TestFrames.solid(0, TestFrames.rgb(135, 150, 30));
        ColorTransform transform = builder.build(before, after, 18);

        // When
        Frame mapped = propagator.apply(transform, TestFrames.solid(7, TestFrames.rgb(105, 150, 45)));

        // Then
        assertEquals(TestFrames.rgb(135, 150, 30), mapped.getRgb(0));
    }

    @Test
    public void testApply_IdenticalInputs_IdenticalOutputs() {
        // Given: a graded transform and two byte-identical frames at different positions
        Frame before = TestFrames.gradient(0, 64, 8);
        Frame after = TestFrames.shifted(before, 20, 5, -10);
        ColorTransform transform = builder.build(before, after);
        Frame a = TestFrames.gradient(10, 64, 8);
        Frame b = TestFrames.gradient(11, 64, 8);

        // When
        Frame mappedA = propagator.apply(transform, a);
        Frame mappedB = propagator.apply(transform, b);

        // Then
        assertTrue(mappedA.samePixels(mappedB));
    }

    @Test
    public void testPropagate_WritesRepresentativeAsIsAndMapsTheRest() throws Exception {
        // Given
        FrameGroup group = new FrameGroup(0, 4, 9, 6);
        Frame original = TestFrames.solid(6, TestFrames.rgb(105, 150, 45));
        Frame edited = TestFrames.solid(6, TestFrames.rgb(135, 150, 30));
        ColorTransform transform = builder.build(original, edited, 18);
        List<Frame> written = new ArrayList<>();

        // When
        propagator.propagate(group, edited, transform,
            index -> TestFrames.solid(index, TestFrames.rgb(105, 150, 45)),
            written::add);

        // Then
        assertEquals(5, written.size());
        for (int i = 0; i < written.size(); i++) {
            Frame frame = written.get(i);
            assertEquals(4 + i, frame.getIndex(), "Frames must be written in sequence order");
            assertEquals(TestFrames.rgb(135, 150, 30), frame.getRgb(0));
        }
        assertSame(edited, written.get(2));
    }
}

package org.learningjava.facevec.domain.model;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.List;

/**
 * Dense row-major float tensor with an explicit shape. Used for NCHW image batches.
 */
public final class FloatTensor {

    private final int[] shape;
    private final float[] data;

    public FloatTensor(int... shape) {
        if (shape.length == 0) throw new IllegalArgumentException("shape must not be empty");
        this.shape = shape.clone();
        this.data = new float[elementCount(this.shape)];
    }

    private FloatTensor(int[] shape, float[] data) {
        this.shape = shape;
        this.data = data;
    }

    public int[] shape() {
        return shape.clone();
    }

    public int dimension(int axis) {
        return shape[axis];
    }

    public int rank() {
        return shape.length;
    }

    public int size() {
        return data.length;
    }

    /** Backing array, row-major. Callers must not modify it. */
    public float[] data() {
        return data;
    }

    public float get(int n, int c, int y, int x) {
        return data[offset(n, c, y, x)];
    }

    public void set(int n, int c, int y, int x, float value) {
        data[offset(n, c, y, x)] = value;
    }

    /** Bytes of item {@code n} along the first axis, big-endian floats. */
    public byte[] itemBytes(int n) {
        int itemSize = data.length / shape[0];
        ByteBuffer buf = ByteBuffer.allocate(itemSize * Float.BYTES);
        for (int i = n * itemSize; i < (n + 1) * itemSize; i++) buf.putFloat(data[i]);
        return buf.array();
    }

    /**
     * Stacks {@code [1, ...]} tensors of identical shape into one {@code [k, ...]} tensor.
     * A single tensor is returned as-is.
     */
    public static FloatTensor concatenate(List<FloatTensor> items) {
        if (items == null || items.isEmpty()) {
            throw new IllegalArgumentException("nothing to concatenate");
        }
        if (items.size() == 1) {
            return items.get(0);
        }
        FloatTensor first = items.get(0);
        int[] itemShape = first.shape;
        if (itemShape[0] != 1) {
            throw new IllegalArgumentException("expected single-item tensors, got " + Arrays.toString(itemShape));
        }
        int[] batchShape = itemShape.clone();
        batchShape[0] = items.size();
        float[] out = new float[elementCount(batchShape)];
        int itemSize = first.data.length;
        for (int i = 0; i < items.size(); i++) {
            FloatTensor t = items.get(i);
            if (!Arrays.equals(t.shape, itemShape)) {
                throw new IllegalArgumentException("shape mismatch at item " + i + ": "
                        + Arrays.toString(t.shape) + " vs " + Arrays.toString(itemShape));
            }
            System.arraycopy(t.data, 0, out, i * itemSize, itemSize);
        }
        return new FloatTensor(batchShape, out);
    }

    private int offset(int n, int c, int y, int x) {
        if (shape.length != 4) throw new IllegalStateException("4-D access on rank " + shape.length + " tensor");
        return ((n * shape[1] + c) * shape[2] + y) * shape[3] + x;
    }

    private static int elementCount(int[] shape) {
        int count = 1;
        for (int d : shape) {
            if (d <= 0) throw new IllegalArgumentException("invalid shape " + Arrays.toString(shape));
            count = Math.multiplyExact(count, d);
        }
        return count;
    }

    @Override
    public String toString() {
        return "FloatTensor" + Arrays.toString(shape);
    }
}

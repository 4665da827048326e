package com.datakeeper.operation.downsampling;

import java.lang.reflect.Array;
import java.util.Arrays;

/**
 * Dense n-dimensional numeric array in row-major order.
 * <p>
 * Values are held as doubles; the element type records the primitive type to convert back to
 * when the array is written out. Long values beyond 2^53 lose precision.
 */
public final class NumericArray {

    private final double[] values;
    private final int[] shape;
    private final Class<?> elementType;

    public NumericArray(double[] values, int[] shape, Class<?> elementType) {
        int size = sizeOf(shape);
        if (values.length != size) {
            throw new IllegalArgumentException(
                    "Shape " + Arrays.toString(shape) + " needs " + size + " values, got " + values.length);
        }
        if (!isNumeric(elementType)) {
            throw new IllegalArgumentException("Not a numeric element type: " + elementType);
        }
        this.values = values;
        this.shape = shape.clone();
        this.elementType = elementType;
    }

    /**
     * Array of the given shape with every element set to {@code value}.
     */
    public static NumericArray filled(double value, Class<?> elementType, int... shape) {
        double[] values = new double[sizeOf(shape)];
        Arrays.fill(values, value);
        return new NumericArray(values, shape, elementType);
    }

    /**
     * Flatten a (possibly multi-dimensional) primitive Java array such as {@code int[][]}.
     *
     * @throws IllegalArgumentException if {@code data} is not a rectangular primitive numeric array
     */
    public static NumericArray fromJavaArray(Object data) {
        if (data == null || !data.getClass().isArray()) {
            throw new IllegalArgumentException("Not an array: " + (data == null ? "null" : data.getClass().getName()));
        }
        int rank = 0;
        Class<?> type = data.getClass();
        while (type.isArray()) {
            rank++;
            type = type.getComponentType();
        }
        if (!isNumeric(type)) {
            throw new IllegalArgumentException("Unsupported element type: " + type.getName());
        }

        int[] shape = new int[rank];
        Object level = data;
        for (int axis = 0; axis < rank; axis++) {
            shape[axis] = Array.getLength(level);
            if (shape[axis] == 0) {
                break;
            }
            level = Array.get(level, 0);
        }

        double[] values = new double[sizeOf(shape)];
        flatten(data, 0, shape, values, new int[]{0});
        return new NumericArray(values, shape, type);
    }

    private static void flatten(Object array, int axis, int[] shape, double[] target, int[] position) {
        int length = Array.getLength(array);
        if (length != shape[axis]) {
            throw new IllegalArgumentException("Ragged array at axis " + axis);
        }
        if (axis == shape.length - 1) {
            for (int i = 0; i < length; i++) {
                target[position[0]++] = ((Number) Array.get(array, i)).doubleValue();
            }
            return;
        }
        for (int i = 0; i < length; i++) {
            flatten(Array.get(array, i), axis + 1, shape, target, position);
        }
    }

    /**
     * Rebuild a multi-dimensional primitive Java array of the element type.
     */
    public Object toJavaArray() {
        Object array = Array.newInstance(elementType, shape);
        if (values.length > 0) {
            fill(array, 0, new int[]{0});
        }
        return array;
    }

    private void fill(Object array, int axis, int[] position) {
        int length = shape[axis];
        if (axis == shape.length - 1) {
            for (int i = 0; i < length; i++) {
                setElement(array, i, values[position[0]++]);
            }
            return;
        }
        for (int i = 0; i < length; i++) {
            fill(Array.get(array, i), axis + 1, position);
        }
    }

    private void setElement(Object array, int index, double value) {
        if (elementType == double.class) {
            Array.setDouble(array, index, value);
        } else if (elementType == float.class) {
            Array.setFloat(array, index, (float) value);
        } else if (elementType == long.class) {
            Array.setLong(array, index, Math.round(value));
        } else if (elementType == int.class) {
            Array.setInt(array, index, (int) Math.round(value));
        } else if (elementType == short.class) {
            Array.setShort(array, index, (short) Math.round(value));
        } else {
            Array.setByte(array, index, (byte) Math.round(value));
        }
    }

    static boolean isNumeric(Class<?> type) {
        return type == double.class || type == float.class || type == long.class
                || type == int.class || type == short.class || type == byte.class;
    }

    static int sizeOf(int[] shape) {
        int size = 1;
        for (int dim : shape) {
            if (dim < 0) {
                throw new IllegalArgumentException("Negative dimension in " + Arrays.toString(shape));
            }
            size = Math.multiplyExact(size, dim);
        }
        return size;
    }

    public int[] getShape() {
        return shape.clone();
    }

    public int getRank() {
        return shape.length;
    }

    public int size() {
        return values.length;
    }

    public Class<?> getElementType() {
        return elementType;
    }

    /**
     * Element at the given row-major flat index.
     */
    public double get(int flatIndex) {
        return values[flatIndex];
    }

    double[] values() {
        return values;
    }

    @Override
    public String toString() {
        return "NumericArray{shape=" + Arrays.toString(shape) + ", type=" + elementType.getSimpleName() + '}';
    }
}

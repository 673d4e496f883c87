package com.jewelrec.common.math;

/**
 * Операции над векторами эмбеддингов. Все векторы хранятся как float[],
 * накопление ведётся в double.
 */
public final class VectorMath {

    /** Допуск при проверке единичной нормы */
    public static final double UNIT_TOLERANCE = 1e-3;

    private VectorMath() {
    }

    /** Скалярное произведение */
    public static double dot(float[] a, float[] b) {
        requireSameDimension(a, b);
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            sum += (double) a[i] * b[i];
        }
        return sum;
    }

    /** Евклидова норма */
    public static double norm(float[] v) {
        double sum = 0.0;
        for (float x : v) {
            sum += (double) x * x;
        }
        return Math.sqrt(sum);
    }

    public static boolean isUnit(float[] v) {
        return Math.abs(norm(v) - 1.0) <= UNIT_TOLERANCE;
    }

    /**
     * Нормализованная копия вектора.
     *
     * @throws IllegalArgumentException для нулевого вектора
     */
    public static float[] normalize(float[] v) {
        double n = norm(v);
        if (n == 0.0 || Double.isNaN(n) || Double.isInfinite(n)) {
            throw new IllegalArgumentException("Cannot normalize a zero or non-finite vector");
        }
        float[] out = new float[v.length];
        for (int i = 0; i < v.length; i++) {
            out[i] = (float) (v[i] / n);
        }
        return out;
    }

    /** Косинусное сходство; 0 если один из векторов нулевой */
    public static double cosine(float[] a, float[] b) {
        double na = norm(a);
        double nb = norm(b);
        if (na == 0.0 || nb == 0.0) {
            return 0.0;
        }
        return dot(a, b) / (na * nb);
    }

    /** Нормализованное среднее двух векторов (эмбеддинг пары) */
    public static float[] average(float[] a, float[] b) {
        return weightedSum(a, 0.5, b, 0.5);
    }

    /** Нормализованная взвешенная сумма двух векторов */
    public static float[] weightedSum(float[] a, double wa, float[] b, double wb) {
        requireSameDimension(a, b);
        float[] out = new float[a.length];
        for (int i = 0; i < a.length; i++) {
            out[i] = (float) (wa * a[i] + wb * b[i]);
        }
        return normalize(out);
    }

    /** Накопить {@code weight * v} в {@code acc} */
    public static void accumulate(double[] acc, float[] v, double weight) {
        if (acc.length != v.length) {
            throw new IllegalArgumentException("Vectors must have the same dimension");
        }
        for (int i = 0; i < v.length; i++) {
            acc[i] += weight * v[i];
        }
    }

    public static float[] toFloat(double[] v) {
        float[] out = new float[v.length];
        for (int i = 0; i < v.length; i++) {
            out[i] = (float) v[i];
        }
        return out;
    }

    private static void requireSameDimension(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException(
                String.format("Vectors must have the same dimension: %d vs %d", a.length, b.length));
        }
    }
}

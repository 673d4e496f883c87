package com.jewelrec.storage.index;

import com.github.jelmerk.hnswlib.core.Item;

/** Обёртка эмбеддинга пула для hnswlib; идентификатор равен позиции в пуле */
public class PoolVector implements Item<Integer, float[]> {

    private static final long serialVersionUID = 1L;

    private final int position;
    private final float[] vector;

    PoolVector(int position, float[] vector) {
        this.position = position;
        this.vector = vector;
    }

    @Override
    public Integer id() {
        return position;
    }

    @Override
    public float[] vector() {
        return vector;
    }

    @Override
    public int dimensions() {
        return vector.length;
    }
}

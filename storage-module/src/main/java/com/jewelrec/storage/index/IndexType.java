package com.jewelrec.storage.index;

public enum IndexType {
    /** Точный перебор по скалярному произведению */
    FLAT,
    /** Приближённый графовый поиск HNSW */
    HNSW
}

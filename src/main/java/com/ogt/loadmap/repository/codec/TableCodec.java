package com.ogt.loadmap.repository.codec;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Formato en disco de un tipo de tabla intermedia.
 */
public interface TableCodec<T> {

    T read(Path path);

    void write(T table, Path path) throws IOException;
}

package com.ogt.loadmap.repository;

import com.ogt.loadmap.repository.codec.TableCodec;

import java.nio.file.Path;
import java.util.function.Supplier;

/**
 * Caché de etapas direccionada por ruta: si la salida existe se relee, si no
 * se calcula y se persiste. La ausencia del archivo es la única invalidación.
 */
public interface StageCache {

    <T> T getOrCompute(Path output, TableCodec<T> codec, Supplier<T> compute, StageMetadata metadata);
}

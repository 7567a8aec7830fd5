package me.golemcore.judge.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Immutable dense vector attached to a graph entity.
 *
 * <p>
 * An entity whose embedding step was skipped carries {@link #none()} rather
 * than {@code null}. Every consumer must branch on {@link #isPresent()} before
 * reading the vector; {@link #vector()} on an absent embedding fails fast.
 *
 * @since 1.0
 */
public final class Embedding {

    private static final Embedding NONE = new Embedding(null);

    private final float[] values;

    private Embedding(float[] values) {
        this.values = values;
    }

    public static Embedding of(float[] vector) {
        Objects.requireNonNull(vector, "vector");
        if (vector.length == 0) {
            throw new IllegalArgumentException("Embedding vector must not be empty");
        }
        return new Embedding(vector.clone());
    }

    public static Embedding of(List<? extends Number> vector) {
        Objects.requireNonNull(vector, "vector");
        float[] values = new float[vector.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = vector.get(i).floatValue();
        }
        return of(values);
    }

    public static Embedding none() {
        return NONE;
    }

    public boolean isPresent() {
        return values != null;
    }

    /**
     * Copy of the vector.
     *
     * @throws IllegalStateException
     *             if the embedding is absent
     */
    public float[] vector() {
        return requireValues().clone();
    }

    public int dimension() {
        return values != null ? values.length : 0;
    }

    /**
     * Vector as a list, the shape graph drivers accept as a property value.
     */
    public List<Double> toList() {
        float[] source = requireValues();
        List<Double> list = new ArrayList<>(source.length);
        for (float value : source) {
            list.add((double) value);
        }
        return list;
    }

    /**
     * Calculates cosine similarity with another embedding. Returns a value between
     * -1 and 1, where 1 means identical direction.
     */
    public double cosineSimilarity(Embedding other) {
        float[] a = requireValues();
        float[] b = other.requireValues();
        if (a.length != b.length) {
            throw new IllegalArgumentException("Vectors must have same length: " + a.length + " vs " + b.length);
        }

        double dotProduct = 0;
        double normA = 0;
        double normB = 0;

        for (int i = 0; i < a.length; i++) {
            dotProduct += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }

        if (normA == 0 || normB == 0) {
            return 0;
        }

        return dotProduct / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    private float[] requireValues() {
        if (values == null) {
            throw new IllegalStateException("Embedding is absent");
        }
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Embedding other)) {
            return false;
        }
        return Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return values != null ? "Embedding[dim=" + values.length + "]" : "Embedding[none]";
    }
}

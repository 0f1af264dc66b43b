package com.fppast.ast;

import java.util.List;

/**
 * A value together with the comment lines written before and after it.
 *
 * @param preAnnotation leading comment lines
 * @param value the annotated value
 * @param postAnnotation trailing comment lines
 * @param <T> the value type
 */
public record Annotated<T>(List<String> preAnnotation, T value, List<String> postAnnotation) {

    public Annotated {
        preAnnotation = List.copyOf(preAnnotation);
        postAnnotation = List.copyOf(postAnnotation);
    }

    public static <T> Annotated<T> of(T value) {
        return new Annotated<>(List.of(), value, List.of());
    }

    /**
     * Returns the annotation in the shape used by fpp-to-json consumers: a list that always
     * holds exactly this one element.
     */
    public List<Annotated<T>> asList() {
        return List.of(this);
    }
}

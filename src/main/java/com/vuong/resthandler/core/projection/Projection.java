package com.vuong.resthandler.core.projection;

import com.vuong.resthandler.dto.ErrorCode;
import com.vuong.resthandler.exception.InternalException;
import com.vuong.resthandler.util.ModelMappingUtil;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Converts elements of a source shape into the shape returned to clients.
 * The target type drives the CSV column layout.
 * <p>
 * Any failure while projecting is reported as an internal fault, whatever the
 * mapping function raised.
 * @param <O> the source type
 * @param <R> the target type
 */
public final class Projection<O, R> {

    private final Class<R> type;
    private final Function<? super O, ? extends R> mapper;

    private Projection(Class<R> type, Function<? super O, ? extends R> mapper) {
        this.type = Objects.requireNonNull(type, "type");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public static <O, R> Projection<O, R> of(Class<R> type, Function<? super O, ? extends R> mapper) {
        return new Projection<>(type, mapper);
    }

    public static <T> Projection<T, T> identity(Class<T> type) {
        return new Projection<>(type, Function.identity());
    }

    /**
     * Projection through ModelMapper's property matching.
     * @param type the target type, needs a no-args constructor
     * @param <O> the source type
     * @param <R> the target type
     * @return the projection
     */
    public static <O, R> Projection<O, R> mapped(Class<R> type) {
        return new Projection<>(type, source -> ModelMappingUtil.map(source, type));
    }

    public Class<R> getType() {
        return type;
    }

    public R apply(O source) {
        try {
            return mapper.apply(source);
        } catch (RuntimeException e) {
            throw new InternalException(ErrorCode.PROJECTION_ERROR,
                    "Failed to project " + (source != null ? source.getClass().getSimpleName() : "null")
                            + " to " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    public List<R> applyAll(List<? extends O> sources) {
        List<R> projected = new ArrayList<>(sources.size());
        for (O source : sources) {
            projected.add(apply(source));
        }
        return projected;
    }
}

package com.vuong.resthandler.util;

import org.modelmapper.ModelMapper;
import org.modelmapper.config.Configuration;
import org.modelmapper.convention.MatchingStrategies;

/**
 * Shared ModelMapper behind {@link com.vuong.resthandler.core.projection.Projection#mapped(Class)}.
 * Properties match by exact name only, so a view receives the source properties it
 * declares and nothing guessed from similar names. Private fields are matched too,
 * which lets views without setters be filled.
 */
public final class ModelMappingUtil {
    private static final ModelMapper modelMapper = createModelMapper();

    private ModelMappingUtil() {
    }

    /**
     * Maps a source object to a new instance of the given class.
     * @param source the object to read from
     * @param outClass the output class, needs a no-args constructor
     * @param <D> the destination type
     * @return the mapped object
     * @throws org.modelmapper.MappingException if a property cannot be converted
     */
    public static <D> D map(Object source, Class<D> outClass) {
        return modelMapper.map(source, outClass);
    }

    private static ModelMapper createModelMapper() {
        ModelMapper mapper = new ModelMapper();
        mapper.getConfiguration()
                .setMatchingStrategy(MatchingStrategies.STRICT)
                .setFieldMatchingEnabled(true)
                .setFieldAccessLevel(Configuration.AccessLevel.PRIVATE);
        return mapper;
    }
}

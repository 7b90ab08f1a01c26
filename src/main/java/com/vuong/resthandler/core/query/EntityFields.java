package com.vuong.resthandler.core.query;

import java.lang.reflect.Field;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reflection helpers shared by the in-memory and JPA query sources.
 * Field lookups walk the class hierarchy and are cached per class.
 */
public final class EntityFields {

    // Cache to avoid repeated reflection cost
    private static final Map<Class<?>, List<String>> SEARCHABLE_CACHE = new ConcurrentHashMap<>();
    private static final Map<Class<?>, Map<String, Optional<Field>>> FIELD_CACHE = new ConcurrentHashMap<>();

    private EntityFields() {
    }

    /**
     * Returns the names of the String fields of a class, used for global search.
     * @param entityClass the class to inspect
     * @return list of field names that are strings
     */
    public static List<String> getSearchableFields(Class<?> entityClass) {
        return SEARCHABLE_CACHE.computeIfAbsent(entityClass, cls -> {
            List<String> fields = new ArrayList<>();
            for (Field f : getAllFields(cls)) {
                if (f.getType().equals(String.class)) {
                    fields.add(f.getName());
                }
            }
            return Collections.unmodifiableList(fields);
        });
    }

    /**
     * Looks a field up by name, including inherited fields.
     * @param clazz the class to inspect
     * @param fieldName the field name
     * @return the field, or null if the class has none by that name
     */
    public static Field getField(Class<?> clazz, String fieldName) {
        return FIELD_CACHE
                .computeIfAbsent(clazz, k -> new ConcurrentHashMap<>())
                .computeIfAbsent(fieldName, k -> Optional.ofNullable(findFieldInHierarchy(clazz, fieldName)))
                .orElse(null);
    }

    public static boolean hasField(Class<?> clazz, String fieldName) {
        return getField(clazz, fieldName) != null;
    }

    /**
     * Reads a field value from an object.
     * @param target the object
     * @param field the field, from {@link #getField(Class, String)}
     * @return the value, possibly null
     */
    public static Object read(Object target, Field field) {
        try {
            if (!field.canAccess(target)) {
                field.setAccessible(true);
            }
            return field.get(target);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot read field " + field.getName() + " of "
                    + target.getClass().getName(), e);
        }
    }

    /**
     * Converts a raw filter value to the type of the field it is compared against.
     * @param value the raw value
     * @param type the field type
     * @return the converted value
     * @throws IllegalArgumentException if the value cannot be converted
     */
    @SuppressWarnings({ "unchecked", "rawtypes" })
    public static Object convert(String value, Class<?> type) {
        if (type == String.class) {
            return value;
        }
        if (type == Boolean.class || type == boolean.class) {
            return Boolean.valueOf(value);
        }
        if (type.isEnum()) {
            return Enum.valueOf((Class<Enum>) type, value);
        }
        Object number = parseNumber(value, type);
        if (number != null) {
            return number;
        }
        return value;
    }

    private static List<Field> getAllFields(Class<?> type) {
        List<Field> fields = new ArrayList<>();
        for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
            Collections.addAll(fields, c.getDeclaredFields());
        }
        return fields;
    }

    private static Field findFieldInHierarchy(Class<?> clazz, String fieldName) {
        Class<?> current = clazz;
        while (current != null && current != Object.class) {
            for (Field field : current.getDeclaredFields()) {
                if (field.getName().equals(fieldName)) {
                    return field;
                }
            }
            current = current.getSuperclass();
        }
        return null;
    }

    private static Object parseNumber(String value, Class<?> type) {
        if (type == Integer.class || type == int.class)
            return Integer.valueOf(value);
        if (type == Long.class || type == long.class)
            return Long.valueOf(value);
        if (type == Double.class || type == double.class)
            return Double.valueOf(value);
        if (type == Float.class || type == float.class)
            return Float.valueOf(value);
        if (type == Short.class || type == short.class)
            return Short.valueOf(value);
        if (type == Byte.class || type == byte.class)
            return Byte.valueOf(value);
        if (type == java.math.BigDecimal.class)
            return new java.math.BigDecimal(value);
        return null;
    }
}

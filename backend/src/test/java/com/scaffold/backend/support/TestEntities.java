package com.scaffold.backend.support;

import java.lang.reflect.Field;

/**
 * Sets generated identifiers on entities built outside a persistence context.
 */
public final class TestEntities {

    private TestEntities() {
    }

    public static <T> T withId(T entity, Object id) {
        Class<?> type = entity.getClass();
        while (type != null) {
            try {
                Field field = type.getDeclaredField("id");
                field.setAccessible(true);
                field.set(entity, id);
                return entity;
            } catch (NoSuchFieldException ex) {
                type = type.getSuperclass();
            } catch (IllegalAccessException ex) {
                throw new IllegalStateException("Failed to set id on " + entity.getClass().getSimpleName(), ex);
            }
        }
        throw new IllegalStateException(entity.getClass().getSimpleName() + " has no id field");
    }
}

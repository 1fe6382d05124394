package com.rememberme.backend.modules.login.application;

import java.util.Map;
import java.util.Optional;

import org.springframework.beans.BeanWrapper;
import org.springframework.beans.DirectFieldAccessor;
import org.springframework.beans.PropertyAccessorFactory;

/**
 * Reads the username out of whatever the host application stored as the current user: a map, a
 * JavaBean or a record.
 */
final class CurrentUserFields {

    private CurrentUserFields() {
    }

    static Optional<String> username(Object currentUser, String field) {
        Object value = read(currentUser, field);
        if (value == null) {
            return Optional.empty();
        }
        String username = value.toString();
        return username.isBlank() ? Optional.empty() : Optional.of(username);
    }

    private static Object read(Object currentUser, String field) {
        if (currentUser instanceof Map<?, ?> map) {
            return map.get(field);
        }
        BeanWrapper bean = PropertyAccessorFactory.forBeanPropertyAccess(currentUser);
        if (bean.isReadableProperty(field)) {
            return bean.getPropertyValue(field);
        }
        DirectFieldAccessor fields = new DirectFieldAccessor(currentUser);
        if (fields.isReadableProperty(field)) {
            return fields.getPropertyValue(field);
        }
        return null;
    }
}

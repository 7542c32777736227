package com.sanctionsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.stream.Collectors;
import java.util.stream.Stream;

public record Address(
        String address1,
        String address2,
        String address3,
        String city,
        String stateOrProvince,
        String postalCode,
        String country
) {
    public static Address of(String city, String country) {
        return new Address(null, null, null, city, null, null, country);
    }

    public String formatted() {
        return Stream.of(address1, address2, address3, city, stateOrProvince, postalCode, country)
                .filter(part -> part != null && !part.isBlank())
                .map(String::trim)
                .collect(Collectors.joining(", "));
    }

    @JsonIgnore
    public boolean isEmpty() {
        return formatted().isEmpty();
    }
}

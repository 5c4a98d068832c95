package com.apispec.schemaGraph.naming;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class EntityNamesTest {

    @Test
    void testEntityNameForTag() {
        assertThat(EntityNames.entityNameForTag("users")).isEqualTo("User");
        assertThat(EntityNames.entityNameForTag("categories")).isEqualTo("Category");
        assertThat(EntityNames.entityNameForTag("addresses")).isEqualTo("Address");
        assertThat(EntityNames.entityNameForTag("order-items")).isEqualTo("OrderItem");
        assertThat(EntityNames.entityNameForTag("store")).isEqualTo("Store");
        assertThat(EntityNames.entityNameForTag("status")).isEqualTo("Status");
        assertThat(EntityNames.entityNameForTag("")).isEqualTo(EntityNames.DEFAULT_TAG);
        assertThat(EntityNames.entityNameForTag(null)).isEqualTo(EntityNames.DEFAULT_TAG);
    }

    @Test
    void testSingularize() {
        assertThat(EntityNames.singularize("pets")).isEqualTo("pet");
        assertThat(EntityNames.singularize("Categories")).isEqualTo("Category");
        assertThat(EntityNames.singularize("classes")).isEqualTo("class");
        assertThat(EntityNames.singularize("class")).isEqualTo("class");
        assertThat(EntityNames.singularize("profile")).isEqualTo("profile");
        assertThat(EntityNames.isPlural("orders")).isTrue();
        assertThat(EntityNames.isPlural("profile")).isFalse();
    }

    @Test
    void testToPascalCase() {
        assertThat(EntityNames.toPascalCase("order_items")).isEqualTo("OrderItems");
        assertThat(EntityNames.toPascalCase("userProfile")).isEqualTo("UserProfile");
        assertThat(EntityNames.toPascalCase("Create Pet Request")).isEqualTo("CreatePetRequest");
        assertThat(EntityNames.toPascalCase("!!")).isEmpty();
    }

    @Test
    void testSanitizeParameterName() {
        assertThat(EntityNames.sanitizeParameterName("user-id")).isEqualTo("userId");
        assertThat(EntityNames.sanitizeParameterName("user_id")).isEqualTo("userId");
        assertThat(EntityNames.sanitizeParameterName("api.version")).isEqualTo("apiVersion");
        assertThat(EntityNames.sanitizeParameterName("$filter")).isEqualTo("filter");
        assertThat(EntityNames.sanitizeParameterName("class")).isEqualTo("classParam");
        assertThat(EntityNames.sanitizeParameterName("2fa")).isEqualTo("_2fa");
        assertThat(EntityNames.sanitizeParameterName("page[size]")).isEqualTo("page_size_");
        assertThat(EntityNames.sanitizeParameterName("")).isEqualTo("param");
        assertThat(EntityNames.sanitizeParameterName(null)).isEqualTo("param");
    }

    @Test
    void testMakeUnique() {
        Set<String> used = new HashSet<>();
        assertThat(EntityNames.makeUnique("userId", used)).isEqualTo("userId");
        assertThat(EntityNames.makeUnique("userId", used)).isEqualTo("userId2");
        assertThat(EntityNames.makeUnique("userId", used)).isEqualTo("userId3");
        assertThat(EntityNames.makeUnique(" ", used)).isEqualTo("param");
        assertThat(used).containsExactlyInAnyOrder("userId", "userId2", "userId3", "param");
    }

    @Test
    void testRemapReservedTypeName() {
        assertThat(EntityNames.remapReservedTypeName("Object")).isEqualTo("ObjectDto");
        assertThat(EntityNames.remapReservedTypeName("User")).isEqualTo("User");
    }
}

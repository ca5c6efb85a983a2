package com.ryuqq.viewstore.core.patch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.viewstore.core.error.PatchApplicationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Patch application and merge tests.
 *
 * @author ViewStore Team
 * @since 1.0.0
 */
class PatchTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static JsonNode json(String text) {
        try {
            return MAPPER.readTree(text.replace('\'', '"'));
        } catch (Exception e) {
            throw new IllegalArgumentException(text, e);
        }
    }

    // ========================================
    // apply
    // ========================================

    @Test
    void builder_DotAndPointerPaths_AddressSameMember() {
        // Given
        Patch dotted = Patch.builder().replace("a.b", 2).build();
        Patch pointer = Patch.builder().replace("/a/b", 2).build();

        // Then
        assertEquals(dotted, pointer);
        assertEquals(json("{'a':{'b':2}}"), dotted.apply(json("{'a':{'b':1}}")));
    }

    @Test
    void apply_LeavesInputDocumentUntouched() {
        // Given
        JsonNode original = json("{'v':1,'tags':['a']}");
        Patch patch = Patch.builder().replace("v", 2).add("/tags/-", "b").build();

        // When
        JsonNode patched = patch.apply(original);

        // Then
        assertEquals(json("{'v':2,'tags':['a','b']}"), patched);
        assertEquals(json("{'v':1,'tags':['a']}"), original);
    }

    @Test
    void apply_AddAtArrayIndex_InsertsAndShifts() {
        JsonNode patched = Patch.builder().add("/tags/0", "z").build().apply(json("{'tags':['a','b']}"));

        assertEquals(json("{'tags':['z','a','b']}"), patched);
    }

    @Test
    void apply_AddBeyondArrayEnd_Throws() {
        Patch patch = Patch.builder().add("/tags/5", "z").build();

        assertThrows(PatchApplicationException.class, () -> patch.apply(json("{'tags':['a']}")));
    }

    @Test
    void apply_ReplaceMissingMember_Throws() {
        Patch patch = Patch.builder().replace("missing", 1).build();

        PatchApplicationException exception = assertThrows(
            PatchApplicationException.class,
            () -> patch.apply(json("{'v':1}"))
        );
        assertTrue(exception.getMessage().contains("/missing"));
    }

    @Test
    void apply_RemoveMissingArrayElement_Throws() {
        Patch patch = Patch.builder().remove("/tags/1").build();

        assertThrows(PatchApplicationException.class, () -> patch.apply(json("{'tags':['a']}")));
    }

    @Test
    void apply_MissingParentContainer_Throws() {
        Patch patch = Patch.builder().add("a.b.c", 1).build();

        assertThrows(PatchApplicationException.class, () -> patch.apply(json("{}")));
    }

    @Test
    void apply_ReplaceAtRoot_ReplacesWholeDocument() {
        Patch patch = Patch.builder().replace("", json("{'x':true}")).build();

        assertEquals(json("{'x':true}"), patch.apply(json("{'v':1}")));
    }

    @Test
    void remove_OfRoot_IsRejected() {
        assertThrows(IllegalArgumentException.class, () -> Patch.builder().remove(""));
    }

    // ========================================
    // RFC 6902 form
    // ========================================

    @Test
    void fromJson_ParsesOperationsInOrder() {
        // Given
        JsonNode document = json("[{'op':'add','path':'/name','value':'x'},{'op':'remove','path':'/v'}]");

        // When
        Patch patch = Patch.fromJson(document);

        // Then
        assertEquals(2, patch.size());
        assertEquals("add", patch.operations().get(0).op());
        assertEquals("remove", patch.operations().get(1).op());
        assertEquals(document, patch.toJson());
        assertEquals(json("{'name':'x'}"), patch.apply(json("{'v':1}")));
    }

    @Test
    void fromJson_UnsupportedOperation_Throws() {
        JsonNode document = json("[{'op':'move','from':'/a','path':'/b'}]");

        PatchApplicationException exception = assertThrows(
            PatchApplicationException.class,
            () -> Patch.fromJson(document)
        );
        assertTrue(exception.getMessage().contains("move"));
    }

    @Test
    void fromJson_NotAnArray_Throws() {
        assertThrows(PatchApplicationException.class, () -> Patch.fromJson(json("{'op':'add'}")));
    }

    // ========================================
    // merge
    // ========================================

    @Test
    void merge_LaterReplaceOfSameMember_SupersedesEarlier() {
        // Given
        Patch first = Patch.builder().replace("v", 1).build();
        Patch second = Patch.builder().replace("v", 2).build();

        // When
        Patch merged = first.merge(second);

        // Then
        assertEquals(1, merged.size());
        assertEquals(json("{'v':2}"), merged.apply(json("{'v':0}")));
    }

    @Test
    void merge_ReplaceOfParent_DropsEarlierChildOperations() {
        // Given
        Patch first = Patch.builder().replace("a.b", 1).add("a.c", 2).build();
        Patch second = Patch.builder().replace("a", json("{'d':3}")).build();

        // When
        Patch merged = first.merge(second);

        // Then
        assertEquals(1, merged.size());
        assertEquals(json("{'a':{'d':3}}"), merged.apply(json("{'a':{'b':0}}")));
    }

    @Test
    void merge_ReplaceOfMemberAddedEarlier_StillApplies() {
        // Given
        Patch first = Patch.builder().add("name", "x").build();
        Patch second = Patch.builder().replace("name", "y").build();

        // When
        Patch merged = first.merge(second);

        // Then
        assertEquals(json("{'v':1,'name':'y'}"), merged.apply(json("{'v':1}")));
    }

    @Test
    void merge_PositionalInserts_AreAllKept() {
        // Given
        Patch first = Patch.builder().add("/tags/0", "x").build();
        Patch second = Patch.builder().add("/tags/0", "y").build();

        // When
        Patch merged = first.merge(second);

        // Then
        assertEquals(2, merged.size());
        assertEquals(json("{'tags':['y','x']}"), merged.apply(json("{'tags':[]}")));
    }

    @Test
    void merge_MixedOperations_EqualsSequentialApplication() {
        // Given
        JsonNode document = json("{'v':1,'name':'a','tags':['p','q'],'meta':{'k':1}}");
        Patch first = Patch.builder().replace("v", 2).remove("/tags/0").add("meta.j", 5).build();
        Patch second = Patch.builder().remove("name").replace("meta", json("{'z':0}")).add("/tags/-", "r").build();

        // When
        JsonNode sequential = second.apply(first.apply(document));
        JsonNode merged = first.merge(second).apply(document);

        // Then
        assertEquals(sequential, merged);
    }

    @Test
    void merge_WithEmpty_ReturnsSamePatch() {
        Patch patch = Patch.builder().replace("v", 1).build();

        assertSame(patch, patch.merge(Patch.empty()));
        assertSame(patch, Patch.empty().merge(patch));
    }
}

package com.ryuqq.viewstore.core.query;

import com.ryuqq.viewstore.core.error.NotSerializableQueryException;
import com.ryuqq.viewstore.core.fixture.Row;
import com.ryuqq.viewstore.core.model.ItemMapper;
import org.junit.jupiter.api.Test;

import java.util.Comparator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RqlQuerySerializerTest {

    private final ItemMapper<Row> mapper = ItemMapper.of(Row.class);
    private final Filter<Row> where = Filter.where(mapper);

    @Test
    void comparisons_UseOperatorNames() {
        assertEquals("eq(v,1)", where.equalTo("v", 1).toQueryString());
        assertEquals("ne(v,1)", where.notEqualTo("v", 1).toQueryString());
        assertEquals("ge(v,2)", where.greaterThanOrEqualTo("v", 2).toQueryString());
        assertEquals("in(v,(1,2))", where.in("v", 1, 2).toQueryString());
        assertEquals("contains(tags,red)", where.contains("tags", "red").toQueryString());
    }

    @Test
    void stringOperands_AreUrlEncoded() {
        assertEquals("eq(name,a%20b%26c)", where.equalTo("name", "a b&c").toQueryString());
        assertEquals("match(name,%5Ea)", where.matches("name", "^a").toQueryString());
    }

    @Test
    void logicalConditions_Nest() {
        // Given
        Filter<Row> between = where.greaterThan("v", 1).lessThan("v", 5);
        Filter<Row> either = where.equalTo("v", 1).or(where.equalTo("v", 2));

        // Then
        assertEquals("and(gt(v,1),lt(v,5))", between.toQueryString());
        assertEquals("or(eq(v,1),eq(v,2))", either.toQueryString());
        assertEquals("not(or(eq(v,1),eq(v,2)))", either.not().toQueryString());
    }

    @Test
    void pointerPaths_AreWrittenInDotForm() {
        assertEquals("eq(tags.0,x)", where.equalTo("/tags/0", "x").toQueryString());
    }

    @Test
    void emptyFilter_SerializesToEmptyString() {
        assertEquals("", where.toQueryString());
    }

    @Test
    void sortAndRange() {
        assertEquals("sort(+v)", Sort.by(mapper, "v").toQueryString());
        assertEquals("sort(-name)", Sort.by(mapper, "name", true).toQueryString());
        assertEquals("limit(10,20)", Range.<Row>of(20, 10).toQueryString());
    }

    @Test
    void customFilterOrComparatorSort_AreRejected() {
        Filter<Row> custom = where.equalTo("v", 1).and(Filter.custom(row -> true));
        Sort<Row> comparator = Sort.by(Comparator.comparing(Row::id));

        assertThrows(NotSerializableQueryException.class, custom::toQueryString);
        assertThrows(NotSerializableQueryException.class, comparator::toQueryString);
    }

    @Test
    void pipeline_JoinsNonEmptyPartsWithAmpersand() {
        // Given
        List<Query<Row>> pipeline = List.of(where, where.equalTo("v", 1), Sort.by(mapper, "v"), Range.of(0, 5));

        // When
        String query = Queries.toQueryString(pipeline);

        // Then
        assertEquals("eq(v,1)&sort(+v)&limit(5,0)", query);
    }
}

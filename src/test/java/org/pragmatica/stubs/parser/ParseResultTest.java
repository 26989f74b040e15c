package org.pragmatica.stubs.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.stubs.error.StubError;
import org.pragmatica.stubs.tree.SourceSpan;

import java.util.ArrayList;

import static org.junit.jupiter.api.Assertions.*;

class ParseResultTest {

    private static final StubError ERROR = new StubError.ConstructionError(SourceSpan.of(2, 3, 2, 8), "Broken");

    @Test
    void success_map_transformsValue() {
        var result = ParseResult.success(20).map(value -> value + 1);

        assertTrue(result.isSuccess());
        assertEquals(21, result.unwrap());
    }

    @Test
    void failure_map_keepsError() {
        ParseResult<Integer> failed = ParseResult.failure(ERROR);

        var result = failed.map(value -> value + 1);

        assertTrue(result.isFailure());
        assertEquals(ERROR, result.fold(error -> error, value -> null));
    }

    @Test
    void success_flatMap_canFail() {
        var result = ParseResult.success("x").flatMap(value -> ParseResult.<Integer>failure(ERROR));

        assertTrue(result.isFailure());
    }

    @Test
    void failure_unwrap_throwsWithMessage() {
        var failed = ParseResult.<String>failure(ERROR);

        var thrown = assertThrows(IllegalStateException.class, failed::unwrap);
        assertTrue(thrown.getMessage().contains("Broken at 2:3"));
    }

    @Test
    void failure_withoutError_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> ParseResult.failure(null));
    }

    @Test
    void callbacks_runOnlyForMatchingOutcome() {
        var seen = new ArrayList<String>();

        ParseResult.success("ok")
                   .onSuccess(value -> seen.add("success:" + value))
                   .onFailure(error -> seen.add("failure"));
        ParseResult.<String>failure(ERROR)
                   .onSuccess(value -> seen.add("success"))
                   .onFailure(error -> seen.add("failure:" + error.message()));

        assertEquals(2, seen.size());
        assertEquals("success:ok", seen.get(0));
        assertEquals("failure:Broken at 2:3", seen.get(1));
    }
}

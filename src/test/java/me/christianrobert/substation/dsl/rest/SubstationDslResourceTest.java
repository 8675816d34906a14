package me.christianrobert.substation.dsl.rest;

import me.christianrobert.substation.dsl.context.CompilationResult;
import me.christianrobert.substation.dsl.ir.SubstationIr;
import me.christianrobert.substation.dsl.service.SubstationDslService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class SubstationDslResourceTest {

    private SubstationDslService mockService;
    private SubstationDslResource resource;

    @BeforeEach
    void setUp() {
        mockService = mock(SubstationDslService.class);
        resource = new SubstationDslResource();
        resource.substationDslService = mockService;
    }

    @Test
    void emptyScriptIsRejectedWithoutCompiling() {
        CompilationResult result = resource.compile(false, "   \n  ");

        assertTrue(result.isFailure());
        assertEquals("DSL script cannot be empty", result.getErrorMessage());
        verify(mockService, never()).compile(anyString(), anyBoolean());
    }

    @Test
    void nullScriptIsRejected() {
        CompilationResult result = resource.compile(false, null);

        assertTrue(result.isFailure());
        verifyNoInteractions(mockService);
    }

    @Test
    void scriptIsPassedToServiceWithAstFlag() {
        CompilationResult expected = CompilationResult.success(SubstationIr.empty(), null, false, "script\n");
        when(mockService.compile("ADD_BUS id=b1, kv=138", true)).thenReturn(expected);

        CompilationResult result = resource.compile(true, "ADD_BUS id=b1, kv=138");

        assertSame(expected, result);
        verify(mockService).compile("ADD_BUS id=b1, kv=138", true);
    }

    @Test
    void failureResultIsReturnedAsIs() {
        CompilationResult failure = CompilationResult.failure("Unexpected error: boom");
        when(mockService.compile(anyString(), anyBoolean())).thenReturn(failure);

        CompilationResult result = resource.compile(false, "VALIDATE");

        assertSame(failure, result);
    }
}

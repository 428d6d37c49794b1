package me.christianrobert.pyunparse.service;

import me.christianrobert.pyunparse.config.service.ConfigService;
import me.christianrobert.pyunparse.context.GenerationResult;
import me.christianrobert.pyunparse.ingest.AstJsonReader;
import me.christianrobert.pyunparse.tree.Expression;
import me.christianrobert.pyunparse.tree.expression.Name;
import me.christianrobert.pyunparse.tree.statement.Module;
import me.christianrobert.pyunparse.tree.statement.Return;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class SourceGenerationServiceTest {

    private static final String FUNCTION_JSON = """
            {"_type": "Module", "body": [
              {"_type": "FunctionDef", "name": "f", "lineno": 1,
               "args": {"_type": "arguments", "args": [], "defaults": []},
               "body": [{"_type": "Return", "lineno": 2, "value": {"_type": "Name", "id": "x"}}],
               "decorator_list": []}]}
            """;

    private ConfigService configService;
    private SourceGenerationService service;

    @BeforeEach
    void setUp() {
        configService = mock(ConfigService.class);
        when(configService.getIndentWith()).thenReturn("    ");
        when(configService.isAddLineInformation()).thenReturn(false);

        // Inject dependencies manually
        service = new SourceGenerationService();
        service.configService = configService;
        service.reader = new AstJsonReader();
    }

    @Test
    void generatesSourceWithConfiguredDefaults() {
        GenerationResult result = service.generate(FUNCTION_JSON);

        assertTrue(result.isSuccess());
        assertEquals("def f():\n    return x", result.getSource());
        assertNull(result.getErrorMessage());
        verify(configService).getIndentWith();
        verify(configService).isAddLineInformation();
    }

    @Test
    void configuredOptionsDriveTheOutput() {
        when(configService.getIndentWith()).thenReturn("\t");
        when(configService.isAddLineInformation()).thenReturn(true);

        GenerationResult result = service.generate(FUNCTION_JSON);

        assertTrue(result.isSuccess());
        assertEquals("# line: 1\ndef f():\n\t# line: 2\n\treturn x", result.getSource());
    }

    @Test
    void explicitOptionsOverrideConfiguration() {
        GenerationResult result = service.generate(FUNCTION_JSON, "  ", false);

        assertEquals("def f():\n  return x", result.getSource());
        verify(configService, never()).getIndentWith();
    }

    @Test
    void unsupportedKindBecomesFailureWithKind() {
        String json = "{\"_type\": \"Module\", \"body\": [{\"_type\": \"AsyncFunctionDef\", \"name\": \"f\"}]}";

        GenerationResult result = service.generate(json, "    ", false);

        assertTrue(result.isFailure());
        assertNull(result.getSource());
        assertEquals("AsyncFunctionDef", result.getKind());
        assertTrue(result.getErrorMessage().contains("AsyncFunctionDef"));
    }

    @Test
    void malformedTreeBecomesFailure() {
        GenerationResult result = service.generate("{\"_type\": \"Module\", \"body\": 5}", "    ", false);

        assertTrue(result.isFailure());
        assertEquals("Module", result.getKind());
    }

    @Test
    void emptyInputIsRejected() {
        assertTrue(service.generate("  ", "    ", false).isFailure());
        assertTrue(service.generate((String) null).isFailure());
    }

    @Test
    void unexpectedReaderErrorBecomesFailure() {
        AstJsonReader failingReader = mock(AstJsonReader.class);
        when(failingReader.read(anyString())).thenThrow(new IllegalStateException("boom"));
        service.reader = failingReader;

        GenerationResult result = service.generate(FUNCTION_JSON, "    ", false);

        assertTrue(result.isFailure());
        assertTrue(result.getErrorMessage().contains("boom"));
        assertNull(result.getKind());
    }

    @Test
    void generatesFromPrebuiltTree() {
        Module module = new Module(List.of(new Return(new Name("x"))));

        GenerationResult result = service.generate(module);

        assertEquals("return x", result.getSource());
    }

    @Test
    void unexpectedErrorInPrebuiltTreeBecomesFailure() {
        // Given: a node whose kind lookup itself fails
        Expression broken = () -> {
            throw new IllegalStateException("kind lookup failed");
        };
        Module module = new Module(List.of(new Return(broken)));

        // When
        GenerationResult result = service.generate(module);

        // Then
        assertTrue(result.isFailure());
        assertNull(result.getSource());
        assertEquals("Unexpected error: kind lookup failed", result.getErrorMessage());
    }
}

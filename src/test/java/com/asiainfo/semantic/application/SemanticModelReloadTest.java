package com.asiainfo.semantic.application;

import com.asiainfo.semantic.core.SemanticModel;
import com.asiainfo.semantic.core.exception.SchemaException;
import com.asiainfo.semantic.infra.loader.ModelDocumentLoader;
import io.quarkus.test.InjectMock;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

/**
 * 加载失败时旧快照继续服务
 */
@QuarkusTest
class SemanticModelReloadTest {

    @InjectMock
    ModelDocumentLoader loader;

    @Inject
    SemanticModelService service;

    @Test
    void testFailedReloadKeepsSnapshot() {
        SemanticModel before = service.model();
        when(loader.load(eq("broken.json"), anyLong(), anyLong()))
                .thenThrow(new SchemaException("Cannot read model document broken.json"));

        assertThrows(SchemaException.class, () -> service.reload("broken.json"));

        assertSame(before, service.model());
        assertEquals("csat-support", service.model().name());
    }
}

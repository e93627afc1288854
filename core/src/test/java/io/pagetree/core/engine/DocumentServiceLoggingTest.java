package io.pagetree.core.engine;

import static io.pagetree.core.testkit.TestTrees.json;
import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.pagetree.core.spi.CacheInvalidator;
import io.pagetree.core.testkit.InMemoryDocumentStore;
import io.pagetree.core.testkit.TestTrees;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/** Structured log lines and MDC handling of the document service. */
@DisplayName("DocumentServiceLoggingTest")
class DocumentServiceLoggingTest {

    private final InMemoryDocumentStore store = new InMemoryDocumentStore();
    private ListAppender<ILoggingEvent> logAppender;
    private Logger serviceLogger;

    @BeforeEach
    void setUp() {
        serviceLogger = (Logger) LoggerFactory.getLogger(DocumentService.class);
        logAppender = new ListAppender<>() {
            @Override
            protected void append(ILoggingEvent event) {
                // capture the MDC while the call is still in progress
                event.prepareForDeferredProcessing();
                super.append(event);
            }
        };
        logAppender.start();
        serviceLogger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        serviceLogger.detachAppender(logAppender);
        logAppender.stop();
    }

    @Test
    @DisplayName("Saved document → INFO line with id, element count and warnings, MDC set during the call")
    void savedDocumentIsLogged() {
        DocumentService service = new DocumentService(store, CacheInvalidator.noop());

        service.update(7, json(TestTrees.SECTION_TREE), false);

        ILoggingEvent saved = logAppender.list.stream()
                .filter(e -> e.getFormattedMessage().startsWith("document.saved"))
                .findFirst()
                .orElseThrow();
        assertThat(saved.getLevel()).isEqualTo(Level.INFO);
        assertThat(saved.getFormattedMessage()).isEqualTo("document.saved document_id=7 element_count=3 warnings=0");
        assertThat(saved.getMDCPropertyMap()).containsEntry(DocumentService.MDC_DOCUMENT_ID, "7");
        assertThat(MDC.get(DocumentService.MDC_DOCUMENT_ID)).isNull();
    }

    @Test
    @DisplayName("Failed cache invalidation → WARN, operation still succeeds")
    void failedInvalidationWarns() {
        DocumentService service = new DocumentService(store, documentId -> false);

        boolean success = service.update(8, json(TestTrees.SINGLE_HEADING), false).isSuccess();

        assertThat(success).isTrue();
        assertThat(logAppender.list)
                .anySatisfy(e -> {
                    assertThat(e.getLevel()).isEqualTo(Level.WARN);
                    assertThat(e.getFormattedMessage()).isEqualTo("document.cache_invalidation_failed document_id=8");
                });
    }

    @Test
    @DisplayName("Rejected tree → INFO line with the error count")
    void rejectionIsLogged() {
        DocumentService service = new DocumentService(store, CacheInvalidator.noop());

        service.update(9, json("{}"), false);

        assertThat(logAppender.list)
                .extracting(ILoggingEvent::getFormattedMessage)
                .contains("document.rejected document_id=9 reason=invalid_tree errors=2");
    }
}

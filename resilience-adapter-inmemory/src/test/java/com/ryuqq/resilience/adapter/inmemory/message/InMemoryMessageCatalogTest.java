package com.ryuqq.resilience.adapter.inmemory.message;

import com.ryuqq.resilience.core.error.ErrorKind;
import com.ryuqq.resilience.core.model.UserMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryMessageCatalog tests.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InMemoryMessageCatalogTest {

    private InMemoryMessageCatalog catalog;

    @BeforeEach
    void setUp() {
        catalog = new InMemoryMessageCatalog();
    }

    @Test
    void 모든_오류_종류에_프랑스어와_말라가시어_메시지가_있음() {
        for (ErrorKind kind : ErrorKind.values()) {
            assertThat(catalog.lookup(kind, "fr").title()).isNotBlank();
            assertThat(catalog.lookup(kind, "mg").title()).isNotBlank();
        }
        assertThat(catalog.supportedLanguages()).containsExactly("fr", "mg");
    }

    @Test
    void lookup_requested_language() {
        UserMessage french = catalog.lookup(ErrorKind.TIMEOUT, "fr");
        UserMessage malagasy = catalog.lookup(ErrorKind.TIMEOUT, "mg");

        assertThat(french.title()).isEqualTo("Délai d'attente dépassé");
        assertThat(malagasy.title()).isEqualTo("Lany ny fotoana fiandrasana");
    }

    @Test
    void 언어가_없으면_기본_언어_사용() {
        assertThat(catalog.defaultLanguage()).isEqualTo("fr");
        assertThat(catalog.lookup(ErrorKind.CLIENT_VALIDATION, null).title()).isEqualTo("Données invalides");
    }

    @Test
    void 지원하지_않는_언어는_기본_언어_메시지로_대체() {
        UserMessage message = catalog.lookup(ErrorKind.RATE_LIMITED, "en");

        assertThat(message.title()).isEqualTo("Trop de requêtes");
    }

    @Test
    void circuitOpen_shares_the_service_unavailable_text() {
        assertThat(catalog.lookup(ErrorKind.CIRCUIT_OPEN, "mg"))
            .isEqualTo(catalog.lookup(ErrorKind.SERVICE_UNAVAILABLE, "mg"));
    }

    @Test
    void 종류가_null이면_요청_언어의_일반_메시지() {
        assertThat(catalog.lookup(null, "mg").title()).isEqualTo("Olana");
        assertThat(catalog.lookup(null, "de").title()).isEqualTo("Erreur");
    }

    @Test
    void register_overrides_and_adds_languages() {
        UserMessage english = new UserMessage("Timeout", "The operation took too long.", "Retry later");

        catalog.register(ErrorKind.TIMEOUT, "en", english);

        assertThat(catalog.lookup(ErrorKind.TIMEOUT, "en")).isEqualTo(english);
        assertThat(catalog.supportedLanguages()).contains("en");
    }

    @Test
    void malagasy_default_language() {
        InMemoryMessageCatalog malagasyFirst = new InMemoryMessageCatalog("mg");

        assertThat(malagasyFirst.lookup(ErrorKind.UNKNOWN, null).title()).isEqualTo("Olana amin'ny rafitra");
        assertThat(malagasyFirst.lookup(ErrorKind.UNKNOWN, "sw").title()).isEqualTo("Olana amin'ny rafitra");
    }

    @Test
    void 잘못된_파라미터는_거부() {
        assertThatThrownBy(() -> new InMemoryMessageCatalog(" "))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> catalog.register(ErrorKind.TIMEOUT, "fr", null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}

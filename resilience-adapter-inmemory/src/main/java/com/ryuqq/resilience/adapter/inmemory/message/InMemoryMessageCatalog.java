package com.ryuqq.resilience.adapter.inmemory.message;

import com.ryuqq.resilience.core.error.ErrorKind;
import com.ryuqq.resilience.core.model.UserMessage;
import com.ryuqq.resilience.core.spi.MessageCatalog;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link MessageCatalog} with French and Malagasy texts.
 *
 * <p>Each {@link ErrorKind} maps to one user-facing message per language. Lookup falls back in
 * this order:</p>
 * <ol>
 *   <li>the message for the requested kind and language</li>
 *   <li>the message for the requested kind in the catalog's default language</li>
 *   <li>the generic message in the requested language</li>
 *   <li>the generic French message</li>
 * </ol>
 *
 * <p>Messages can be overridden or added at runtime with {@link #register(ErrorKind, String, UserMessage)}.
 * The catalog is thread-safe.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * MessageCatalog catalog = new InMemoryMessageCatalog("fr");
 * UserMessage message = catalog.lookup(ErrorKind.TIMEOUT, "mg");
 * // message.title() → "Lany ny fotoana fiandrasana"
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryMessageCatalog implements MessageCatalog {

    public static final String FRENCH = "fr";
    public static final String MALAGASY = "mg";

    private static final Map<String, UserMessage> GENERIC = Map.of(
        FRENCH, new UserMessage(
            "Erreur",
            "Une erreur inattendue s'est produite.",
            "Veuillez réessayer"),
        MALAGASY, new UserMessage(
            "Olana",
            "Nisy olana tsy nampoizina.",
            "Andramo indray azafady")
    );

    private final String defaultLanguage;
    private final Map<ErrorKind, Map<String, UserMessage>> messages = new EnumMap<>(ErrorKind.class);

    /**
     * Creates a catalog whose default language is French.
     */
    public InMemoryMessageCatalog() {
        this(FRENCH);
    }

    /**
     * Creates a catalog with the given default language.
     *
     * @param defaultLanguage language used when a lookup names none
     * @throws IllegalArgumentException if defaultLanguage is null or blank
     */
    public InMemoryMessageCatalog(String defaultLanguage) {
        if (defaultLanguage == null || defaultLanguage.isBlank()) {
            throw new IllegalArgumentException("defaultLanguage cannot be null or blank");
        }
        this.defaultLanguage = defaultLanguage;
        for (ErrorKind kind : ErrorKind.values()) {
            messages.put(kind, new ConcurrentHashMap<>());
        }
        loadDefaults();
    }

    @Override
    public UserMessage lookup(ErrorKind kind, String languageTag) {
        String language = languageTag == null || languageTag.isBlank() ? defaultLanguage : languageTag;
        if (kind != null) {
            Map<String, UserMessage> byLanguage = messages.get(kind);
            UserMessage message = byLanguage.get(language);
            if (message != null) {
                return message;
            }
            message = byLanguage.get(defaultLanguage);
            if (message != null) {
                return message;
            }
        }
        return GENERIC.getOrDefault(language, GENERIC.get(FRENCH));
    }

    @Override
    public String defaultLanguage() {
        return defaultLanguage;
    }

    /**
     * Registers or replaces the message for a kind and language.
     *
     * @param kind error kind
     * @param languageTag language tag
     * @param message message to return
     * @throws IllegalArgumentException if any argument is null or the language is blank
     */
    public void register(ErrorKind kind, String languageTag, UserMessage message) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (languageTag == null || languageTag.isBlank()) {
            throw new IllegalArgumentException("languageTag cannot be null or blank");
        }
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        messages.get(kind).put(languageTag, message);
    }

    /**
     * Returns every language that has at least one registered message.
     *
     * @return sorted language tags
     */
    public Set<String> supportedLanguages() {
        Set<String> languages = new TreeSet<>();
        for (Map<String, UserMessage> byLanguage : messages.values()) {
            languages.addAll(byLanguage.keySet());
        }
        return Collections.unmodifiableSet(languages);
    }

    private void loadDefaults() {
        UserMessage networkFr = new UserMessage(
            "Problème de connexion",
            "Impossible de se connecter au service. Vérifiez votre connexion internet et réessayez.",
            "Réessayer dans quelques instants");
        UserMessage networkMg = new UserMessage(
            "Olana amin'ny fifandraisana",
            "Tsy afaka mifandray amin'ny serivisy. Hamarino ny fifandraisanao amin'ny Internet ary andramo indray.",
            "Andramo indray afaka kelikely");
        register(ErrorKind.TRANSIENT_NETWORK, FRENCH, networkFr);
        register(ErrorKind.TRANSIENT_NETWORK, MALAGASY, networkMg);

        register(ErrorKind.TIMEOUT, FRENCH, new UserMessage(
            "Délai d'attente dépassé",
            "L'opération prend plus de temps que prévu. Le service pourrait être temporairement surchargé.",
            "Veuillez patienter et réessayer"));
        register(ErrorKind.TIMEOUT, MALAGASY, new UserMessage(
            "Lany ny fotoana fiandrasana",
            "Maharitra loatra ny asa. Mety ho be loatra ny fampiasana ny serivisy ankehitriny.",
            "Miandrasa kely ary andramo indray"));

        UserMessage unavailableFr = new UserMessage(
            "Service temporairement indisponible",
            "Le service demandé n'est pas disponible actuellement. Nous utilisons un service de secours.",
            "Fonctionnalité limitée disponible");
        UserMessage unavailableMg = new UserMessage(
            "Tsy misy serivisy ankehitriny",
            "Tsy misy ny serivisy takiana ankehitriny. Mampiasa serivisy hafa isika.",
            "Misy fiasa voafetra azo ampiasaina");
        register(ErrorKind.SERVICE_UNAVAILABLE, FRENCH, unavailableFr);
        register(ErrorKind.SERVICE_UNAVAILABLE, MALAGASY, unavailableMg);
        register(ErrorKind.CIRCUIT_OPEN, FRENCH, unavailableFr);
        register(ErrorKind.CIRCUIT_OPEN, MALAGASY, unavailableMg);

        UserMessage tooManyFr = new UserMessage(
            "Trop de requêtes",
            "Vous avez effectué trop de requêtes. Veuillez patienter avant de réessayer.",
            "Attendez quelques minutes avant de continuer");
        UserMessage tooManyMg = new UserMessage(
            "Be loatra ny fangatahana",
            "Nanao fangatahana be loatra ianao. Miandrasa aloha vao manandrana indray.",
            "Miandry minitra vitsivitsy alohan'ny hanohy");
        register(ErrorKind.RATE_LIMITED, FRENCH, tooManyFr);
        register(ErrorKind.RATE_LIMITED, MALAGASY, tooManyMg);
        register(ErrorKind.CAPACITY_EXCEEDED, FRENCH, tooManyFr);
        register(ErrorKind.CAPACITY_EXCEEDED, MALAGASY, tooManyMg);

        register(ErrorKind.CLIENT_VALIDATION, FRENCH, new UserMessage(
            "Données invalides",
            "Les informations fournies ne sont pas valides ou incomplètes.",
            "Vérifiez et corrigez les champs marqués en rouge"));
        register(ErrorKind.CLIENT_VALIDATION, MALAGASY, new UserMessage(
            "Angon-drakitra tsy mety",
            "Tsy mety na tsy feno ny fampahalalana nomenao.",
            "Hamarino sy ahitsio ny saha voamarika mena"));

        register(ErrorKind.UNKNOWN, FRENCH, new UserMessage(
            "Erreur système",
            "Une erreur inattendue s'est produite. Notre équipe technique a été notifiée.",
            "Réessayez dans quelques minutes"));
        register(ErrorKind.UNKNOWN, MALAGASY, new UserMessage(
            "Olana amin'ny rafitra",
            "Nisy olana tsy nampoizina. Efa nampandrenesina ny ekipanay ara-teknika.",
            "Andramo indray afaka minitra vitsivitsy"));
    }
}

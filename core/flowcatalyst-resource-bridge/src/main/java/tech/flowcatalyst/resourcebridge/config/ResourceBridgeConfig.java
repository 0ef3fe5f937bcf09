package tech.flowcatalyst.resourcebridge.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration for the resource bridge.
 *
 * Example configuration:
 * <pre>
 * resourcebridge.credentials.default-lifetime-days=30
 * resourcebridge.authorization.allow-anonymous=false
 * resourcebridge.engine.default-list-limit=50
 * </pre>
 */
@ConfigMapping(prefix = "resourcebridge")
public interface ResourceBridgeConfig {

    Credentials credentials();

    Authorization authorization();

    Engine engine();

    interface Credentials {

        /**
         * Lifetime applied to a credential created without an explicit expiry.
         */
        @WithName("default-lifetime-days")
        @WithDefault("90")
        int defaultLifetimeDays();

        /**
         * Leading segment of issued tokens ("mcp" gives "mcp_&lt;key&gt;_&lt;secret&gt;").
         */
        @WithName("token-prefix")
        @WithDefault("mcp")
        String tokenPrefix();
    }

    /**
     * Default-allow switches of the permission gate.
     * Turning these off makes the gate deny instead.
     */
    interface Authorization {

        /**
         * Allow commands that arrive without a principal.
         */
        @WithName("allow-anonymous")
        @WithDefault("true")
        boolean allowAnonymous();

        /**
         * Allow every action on resources whose descriptor declares no permission policy.
         */
        @WithName("allow-undeclared-policy")
        @WithDefault("true")
        boolean allowUndeclaredPolicy();

        /**
         * Allow actions outside view/add/change/delete.
         */
        @WithName("allow-unknown-action")
        @WithDefault("true")
        boolean allowUnknownAction();
    }

    interface Engine {

        @WithName("default-list-limit")
        @WithDefault("100")
        int defaultListLimit();

        /**
         * Maximum records per relation attached by get with include_related.
         */
        @WithName("related-preview-limit")
        @WithDefault("10")
        int relatedPreviewLimit();

        /**
         * Maximum child records per inline attached by get with include_inlines.
         */
        @WithName("inline-limit")
        @WithDefault("100")
        int inlineLimit();

        @WithName("history-default-limit")
        @WithDefault("50")
        int historyDefaultLimit();

        @WithName("autocomplete-default-limit")
        @WithDefault("20")
        int autocompleteDefaultLimit();

        @WithName("audit-repr-max-length")
        @WithDefault("200")
        int auditReprMaxLength();

        @WithName("bulk-change-message-max-length")
        @WithDefault("500")
        int bulkChangeMessageMaxLength();
    }
}

package io.fhirrules.core.model;

import io.fhirrules.core.error.RuleConfigurationException;
import io.fhirrules.core.path.PathExpression;
import java.util.Optional;

/**
 * One authored business rule.
 *
 * <p>
 * Construction enforces the authoring invariants:
 * <ul>
 * <li>{@code params} belong to the declared {@code type};</li>
 * <li>every type except the record-scoped ones has a {@code fieldPath};</li>
 * <li>the error code comes from the closed vocabulary of the type. A fixed
 * code is filled in when omitted and rejected when different. A
 * custom-expression code must be governed. A question-answer code is derived
 * from its constraint.</li>
 * </ul>
 * A grammatical field path that is not in stored form (resource-type prefix,
 * index marker, {@code where} clause) is accepted here; the governance review
 * blocks it before persistence.
 *
 * @param id           unique id within the rule set
 * @param resourceType owning resource type, e.g. {@code Patient}
 * @param scope        which instances are evaluated; defaults to
 *                     {@link InstanceScope#ALL}
 * @param type         the rule type
 * @param fieldPath    resource-relative path, {@code null} for record-scoped
 *                     rules
 * @param params       type-specific params
 * @param severity     severity of produced findings; defaults to
 *                     {@link Severity#ERROR}
 * @param errorCode    the code of produced findings
 * @param hint         optional human hint shown with findings
 * @param enabled      disabled rules are skipped during evaluation
 */
public record Rule(
        String id,
        String resourceType,
        InstanceScope scope,
        RuleType type,
        PathExpression fieldPath,
        RuleParams params,
        Severity severity,
        String errorCode,
        String hint,
        boolean enabled) {

    public Rule {
        if (id == null || id.isBlank()) {
            throw new RuleConfigurationException("Rule id must not be blank", id);
        }
        if (resourceType == null || resourceType.isBlank()) {
            throw new RuleConfigurationException("Rule '" + id + "' needs a resourceType", id);
        }
        if (type == null) {
            throw new RuleConfigurationException("Rule '" + id + "' needs a type", id);
        }
        if (params == null) {
            throw new RuleConfigurationException("Rule '" + id + "' needs params for type " + type.wireName(), id);
        }
        if (params.type() != type) {
            throw new RuleConfigurationException(
                    String.format(
                            "Rule '%s' declares type %s but carries %s params",
                            id, type.wireName(), params.type().wireName()),
                    id);
        }
        if (!type.recordScoped() && fieldPath == null) {
            throw new RuleConfigurationException("Rule '" + id + "' of type " + type.wireName() + " needs a fieldPath", id);
        }
        scope = scope == null ? InstanceScope.ALL : scope;
        severity = severity == null ? Severity.ERROR : severity;
        errorCode = resolveErrorCode(id, type, params, errorCode);
    }

    /** Starts a builder. */
    public static Builder builder() {
        return new Builder();
    }

    /** The field path text, or {@code null} for record-scoped rules. */
    public String fieldPathText() {
        return fieldPath == null ? null : fieldPath.text();
    }

    /** Optional hint. */
    public Optional<String> hintOpt() {
        return Optional.ofNullable(hint);
    }

    private static String resolveErrorCode(String id, RuleType type, RuleParams params, String requested) {
        String code = requested == null || requested.isBlank() ? null : requested.trim();
        return switch (type) {
            case REQUIRED, FIXED_VALUE, ALLOWED_VALUES, REGEX, ARRAY_LENGTH, CODE_SYSTEM, RESOURCE_COMPOSITION -> {
                String fixed = ErrorCodes.fixedCodeFor(type).orElseThrow();
                if (code != null && !code.equals(fixed)) {
                    throw new RuleConfigurationException(
                            String.format(
                                    "Rule '%s': %s rules always report %s, got '%s'",
                                    id, type.wireName(), fixed, code),
                            id);
                }
                yield fixed;
            }
            case CUSTOM_EXPRESSION -> {
                if (code == null) {
                    throw new RuleConfigurationException(
                            "Rule '" + id + "': CustomExpression rules need an errorCode", id);
                }
                if (!ErrorCodes.GOVERNED_CUSTOM_CODES.contains(code)) {
                    throw new RuleConfigurationException(
                            String.format(
                                    "Rule '%s': errorCode '%s' is not in the governed vocabulary %s",
                                    id, code, ErrorCodes.GOVERNED_CUSTOM_CODES),
                            id);
                }
                yield code;
            }
            case QUESTION_ANSWER -> {
                String derived = ((RuleParams.QuestionAnswerParams) params).constraint().errorCode();
                if (code != null && !code.equals(derived)) {
                    throw new RuleConfigurationException(
                            String.format(
                                    "Rule '%s': the constraint determines errorCode %s, got '%s'",
                                    id, derived, code),
                            id);
                }
                yield derived;
            }
        };
    }

    /** Builder for {@link Rule}. Paths are given as text and parsed on {@link #build()}. */
    public static final class Builder {
        private String id;
        private String resourceType;
        private InstanceScope scope = InstanceScope.ALL;
        private RuleType type;
        private String fieldPath;
        private RuleParams params;
        private Severity severity = Severity.ERROR;
        private String errorCode;
        private String hint;
        private boolean enabled = true;

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder resourceType(String resourceType) {
            this.resourceType = resourceType;
            return this;
        }

        public Builder scope(InstanceScope scope) {
            this.scope = scope;
            return this;
        }

        public Builder fieldPath(String fieldPath) {
            this.fieldPath = fieldPath;
            return this;
        }

        /** Sets the params; the type follows from them. */
        public Builder params(RuleParams params) {
            this.params = params;
            this.type = params == null ? null : params.type();
            return this;
        }

        /** Overrides the type, e.g. to build a deliberately inconsistent rule. */
        public Builder type(RuleType type) {
            this.type = type;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder errorCode(String errorCode) {
            this.errorCode = errorCode;
            return this;
        }

        public Builder hint(String hint) {
            this.hint = hint;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Rule build() {
            PathExpression path = fieldPath == null ? null : PathExpression.parse(fieldPath);
            return new Rule(id, resourceType, scope, type, path, params, severity, errorCode, hint, enabled);
        }
    }
}

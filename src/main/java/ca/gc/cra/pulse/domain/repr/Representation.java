package ca.gc.cra.pulse.domain.repr;

/**
 * <strong>What:</strong> Whitelisted-attribute snapshot of an engine object.
 * <p><strong>Why:</strong> Engine objects cannot cross the process boundary; each kind is reduced to a
 * fixed structure whose optional attributes are explicit {@link Attr} values.</p>
 * <p><strong>Role:</strong> Domain payload carried by wire messages and consumed by run-event handlers.</p>
 * <p><strong>Thread-safety:</strong> All variants are immutable records.</p>
 *
 * @since 0.1.0
 */
public sealed interface Representation
    permits ConfigRepr,
        SessionRepr,
        NodeRepr,
        CollectReportRepr,
        TestReportRepr,
        WarningRepr,
        UnrepresentableRepr {}

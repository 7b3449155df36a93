package io.b2mash.credits.ledger;

/**
 * Ledger acknowledgement of a grant. {@code duplicate} is true when the ledger had already applied
 * a grant with the same idempotency key; the grant still counts as credited.
 */
public record GrantReceipt(String grantId, boolean duplicate) {}

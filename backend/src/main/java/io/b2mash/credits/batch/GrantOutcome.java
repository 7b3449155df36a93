package io.b2mash.credits.batch;

/** How a single user's grant ended. Both CREDITED and ALREADY_APPLIED count as credited. */
enum GrantOutcome {
  CREDITED,
  ALREADY_APPLIED,
  FAILED
}

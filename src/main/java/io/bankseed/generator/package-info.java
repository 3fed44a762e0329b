/**
 * Deterministic record generators, one per entity type, and the identifier registry they
 * draw references from.
 *
 * <p>A record is a pure function of its type, sequence position, seed, lineage tag, window
 * and the registry contents of earlier stages. Resuming from any cursor therefore re-emits
 * exactly the records an uninterrupted run would have emitted.
 */
package io.bankseed.generator;

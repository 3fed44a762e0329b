/**
 * Value types shared across the engine: task rows, entity catalog, windows and checkpoint cursors.
 */
package io.bankseed.model;

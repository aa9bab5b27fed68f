/**
 * Sample application used by the contract tests: a {@code create-entity} operation over an
 * in-memory store, its validator and authorizer, and the wiring plan that assembles it.
 */
package com.ryuqq.opwire.testkit.sample;

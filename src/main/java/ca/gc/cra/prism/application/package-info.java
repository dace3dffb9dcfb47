/**
 * Application layer for PRISM: remote-write use cases and the ports they depend on.
 * <p><strong>Role:</strong> Orchestrates encode, pack, and deliver without binding to DNS, HTTP, or compression libraries.</p>
 * <p><strong>Concurrency:</strong> Use cases assume a single writer per instance unless documented otherwise.</p>
 */
package ca.gc.cra.prism.application;

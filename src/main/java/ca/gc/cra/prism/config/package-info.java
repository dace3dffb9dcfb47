/**
 * Configuration records and loaders for PRISM CLIs.
 * <p><strong>Role:</strong> Adapter-side configuration: YAML loading, CLI merging, defaults, and validated settings.</p>
 * <p><strong>Concurrency:</strong> Loaders are stateless; resulting configuration objects are immutable.</p>
 * <p><strong>Security:</strong> Basic-auth passwords are held in memory only and redacted whenever printed.</p>
 */
package ca.gc.cra.prism.config;

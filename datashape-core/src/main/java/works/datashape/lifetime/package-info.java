/**
 * The transient / owned / borrowed discipline for extracted string and byte data.
 * <p>
 * The garbage collector makes dangling references impossible in Java,
 * so the distinction is a contract rather than a memory-safety mechanism:
 * transient data must be copied before it is retained,
 * and borrowed data is only valid until its {@link works.datashape.lifetime.InputBuffer}
 * is released.
 * The three-flavor API is preserved so that formats can avoid copies
 * when the input allows it.
 */
package works.datashape.lifetime;

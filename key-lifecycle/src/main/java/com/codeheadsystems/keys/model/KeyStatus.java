package com.codeheadsystems.keys.model;

/**
 * Lifecycle status of an encryption key.
 *
 * <pre>
 * ACTIVE -&gt; ROTATING -&gt; EXPIRED
 * ACTIVE -&gt; COMPROMISED
 * * -&gt; DELETED
 * </pre>
 *
 * <p>A backup copy is recorded on the key's metadata rather than by moving it to {@link #BACKED_UP}; the
 * value exists so files written by other tools can still be read.</p>
 */
public enum KeyStatus {
  /**
   * Used for new encryption. One per purpose.
   */
  ACTIVE,
  /**
   * Replaced, kept for decryption through the purpose's grace period.
   */
  ROTATING,
  /**
   * Past its grace period.
   */
  EXPIRED,
  /**
   * Marked by an operator as exposed.
   */
  COMPROMISED,
  /**
   * Annotation only, see class docs.
   */
  BACKED_UP,
  /**
   * Terminal.
   */
  DELETED
}

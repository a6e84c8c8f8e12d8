/**
 * The ext API associates arbitrary data with instances of
 * {@link io.github.eutro.livevars.core.ext.ExtContainer}, without adding fields
 * to the IR classes.
 *
 * <pre>{@code
 * class BlockExts {
 *   public static final Ext<Integer> DEPTH = Ext.create(Integer.class, "DEPTH");
 * }
 *
 * block.attachExt(BlockExts.DEPTH, 3);
 * block.getExtOrThrow(BlockExts.DEPTH); // => 3
 * }</pre>
 * <p>
 * Analyses attach their results this way, for example the predecessor lists
 * of blocks and the liveness tables of functions, and
 * {@link io.github.eutro.livevars.core.ext.MetadataState} records which of
 * them are still valid.
 * <p>
 * Some IR classes store frequently used exts in fields instead of the map.
 */
package io.github.eutro.livevars.core.ext;

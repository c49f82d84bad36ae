/**
 * Binary cube layout and the cube-level error taxonomy.
 *
 * @since 0.1.0
 */
package ca.gc.cra.radcorr.domain.cube;

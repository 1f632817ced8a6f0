/**
 * The data model registry: the closed set of {@link works.datashape.model.Shape shapes}
 * and the {@link works.datashape.model.Classifier classification} of values into them.
 */
package works.datashape.model;

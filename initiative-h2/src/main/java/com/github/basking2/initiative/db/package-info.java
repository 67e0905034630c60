/**
 * Keep the initiative store in an embedded H2 database.
 *
 * There are 3 parts to this database.
 *
 * <ol>
 *     <li>{@link com.github.basking2.initiative.db.MigrationDriver} brings the database to a schema version of a
 *         {@link com.github.basking2.initiative.schema.SchemaRegistry}, one Flyway migration per version.</li>
 *     <li>{@link com.github.basking2.initiative.db.ThingMyBatis} and
 *         {@link com.github.basking2.initiative.db.KeyValueMyBatis} read and write records and settings,
 *         reporting failures as {@link com.github.basking2.initiative.StoreResult}s.</li>
 *     <li>{@link com.github.basking2.initiative.db.InitiativeStore} is what clients call. It flattens every
 *         failure into {@code false} or {@code null}.</li>
 * </ol>
 */
package com.github.basking2.initiative.db;

package com.github.basking2.initiative.db;

import com.github.basking2.initiative.StoreResult;
import com.github.basking2.initiative.Thing;
import org.apache.ibatis.exceptions.PersistenceException;
import org.apache.ibatis.session.SqlSession;
import org.apache.ibatis.session.SqlSessionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Access to the {@code things} table. Every call runs in its own session and reports its outcome as a
 * {@link StoreResult}; nothing is thrown.
 */
public class ThingMyBatis {
    private static final Logger LOG = LoggerFactory.getLogger(ThingMyBatis.class);

    private final SqlSessionManager sqlSessionManager;

    public ThingMyBatis(final SqlSessionManager sqlSessionManager) {
        this.sqlSessionManager = sqlSessionManager;
    }

    public StoreResult<Thing> get(final String uuid) {
        try (final SqlSession session = sqlSessionManager.openSession()) {
            return first(session.getMapper(ThingMapper.class).get(uuid));
        }
        catch (final PersistenceException | IOException e) {
            LOG.warn("Loading thing {}.", uuid, e);
            return StoreResult.failure(e);
        }
    }

    public StoreResult<Thing> getByName(final String name) {
        try (final SqlSession session = sqlSessionManager.openSession()) {
            return first(session.getMapper(ThingMapper.class).getByName(name));
        }
        catch (final PersistenceException | IOException e) {
            LOG.warn("Loading thing named {}.", name, e);
            return StoreResult.failure(e);
        }
    }

    public StoreResult<List<Thing>> all() {
        try (final SqlSession session = sqlSessionManager.openSession()) {
            final List<Thing> things = new ArrayList<>();
            for (final String data : session.getMapper(ThingMapper.class).all()) {
                things.add(JsonDocuments.toThing(data));
            }
            return StoreResult.ok(things);
        }
        catch (final PersistenceException | IOException e) {
            LOG.warn("Loading all things.", e);
            return StoreResult.failure(e);
        }
    }

    /**
     * Insert or replace a thing by its uuid.
     *
     * @param thing The thing.
     * @return {@link StoreResult.Status#CONSTRAINT_VIOLATION} when the uuid is missing or another thing already
     *     has the name. The stored things are unchanged in that case.
     */
    public StoreResult<Thing> put(final Thing thing) {
        if (thing == null || thing.getUuid() == null) {
            return StoreResult.constraintViolation(new IllegalArgumentException("A thing needs a uuid to be saved."));
        }

        try (final SqlSession session = sqlSessionManager.openSession()) {
            final ThingMapper mapper = session.getMapper(ThingMapper.class);
            mapper.put(thing.getUuid(), thing.getName(), thing.getType(), JsonDocuments.toJson(thing));
            session.commit();
            return StoreResult.ok(thing);
        }
        catch (final PersistenceException | IOException e) {
            LOG.warn("Saving thing {} named {}.", thing.getUuid(), thing.getName(), e);
            return StoreResult.failure(e);
        }
    }

    /**
     * Delete a thing. Deleting a uuid that is not stored succeeds.
     */
    public StoreResult<Void> delete(final String uuid) {
        try (final SqlSession session = sqlSessionManager.openSession()) {
            final int removed = session.getMapper(ThingMapper.class).delete(uuid);
            session.commit();
            LOG.debug("Deleted {} things with uuid {}.", removed, uuid);
            return StoreResult.ok();
        }
        catch (final PersistenceException e) {
            LOG.warn("Deleting thing {}.", uuid, e);
            return StoreResult.failure(e);
        }
    }

    public StoreResult<Void> clear() {
        try (final SqlSession session = sqlSessionManager.openSession()) {
            session.getMapper(ThingMapper.class).clear();
            session.commit();
            return StoreResult.ok();
        }
        catch (final PersistenceException e) {
            LOG.warn("Clearing things.", e);
            return StoreResult.failure(e);
        }
    }

    private static StoreResult<Thing> first(final List<String> data) throws IOException {
        if (data.isEmpty()) {
            return StoreResult.notFound();
        }
        else {
            return StoreResult.ok(JsonDocuments.toThing(data.get(0)));
        }
    }
}

package com.github.basking2.initiative.db;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.basking2.initiative.StoreResult;
import org.apache.ibatis.exceptions.PersistenceException;
import org.apache.ibatis.session.SqlSession;
import org.apache.ibatis.session.SqlSessionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Access to the settings in the {@code key_value} table. Values are any JSON value.
 */
public class KeyValueMyBatis {
    private static final Logger LOG = LoggerFactory.getLogger(KeyValueMyBatis.class);

    private static final String KEY = "key";
    private static final String VALUE = "value";

    private final SqlSessionManager sqlSessionManager;

    public KeyValueMyBatis(final SqlSessionManager sqlSessionManager) {
        this.sqlSessionManager = sqlSessionManager;
    }

    public StoreResult<JsonNode> get(final String key) {
        try (final SqlSession session = sqlSessionManager.openSession()) {
            final List<String> data = session.getMapper(KeyValueMapper.class).get(key);
            if (data.isEmpty()) {
                return StoreResult.notFound();
            }
            else {
                return StoreResult.ok(JsonDocuments.readDocument(data.get(0)).path(VALUE));
            }
        }
        catch (final PersistenceException | IOException e) {
            LOG.warn("Loading value {}.", key, e);
            return StoreResult.failure(e);
        }
    }

    /**
     * @return Every setting, ordered by key.
     */
    public StoreResult<Map<String, JsonNode>> all() {
        try (final SqlSession session = sqlSessionManager.openSession()) {
            final Map<String, JsonNode> entries = new LinkedHashMap<>();
            for (final String data : session.getMapper(KeyValueMapper.class).all()) {
                final ObjectNode document = JsonDocuments.readDocument(data);
                entries.put(document.path(KEY).asText(), document.path(VALUE));
            }
            return StoreResult.ok(entries);
        }
        catch (final PersistenceException | IOException e) {
            LOG.warn("Loading all values.", e);
            return StoreResult.failure(e);
        }
    }

    public StoreResult<Void> put(final String key, final JsonNode value) {
        if (key == null) {
            return StoreResult.constraintViolation(new IllegalArgumentException("A value needs a key to be saved."));
        }

        final ObjectNode document = JsonDocuments.MAPPER.createObjectNode();
        document.put(KEY, key);
        document.set(VALUE, value);

        try (final SqlSession session = sqlSessionManager.openSession()) {
            session.getMapper(KeyValueMapper.class).put(key, JsonDocuments.toJson(document));
            session.commit();
            return StoreResult.ok();
        }
        catch (final PersistenceException | IOException e) {
            LOG.warn("Saving value {}.", key, e);
            return StoreResult.failure(e);
        }
    }

    /**
     * Delete a setting. Deleting a key that is not stored succeeds.
     */
    public StoreResult<Void> delete(final String key) {
        try (final SqlSession session = sqlSessionManager.openSession()) {
            session.getMapper(KeyValueMapper.class).delete(key);
            session.commit();
            return StoreResult.ok();
        }
        catch (final PersistenceException e) {
            LOG.warn("Deleting value {}.", key, e);
            return StoreResult.failure(e);
        }
    }

    public StoreResult<Void> clear() {
        try (final SqlSession session = sqlSessionManager.openSession()) {
            session.getMapper(KeyValueMapper.class).clear();
            session.commit();
            return StoreResult.ok();
        }
        catch (final PersistenceException e) {
            LOG.warn("Clearing values.", e);
            return StoreResult.failure(e);
        }
    }
}

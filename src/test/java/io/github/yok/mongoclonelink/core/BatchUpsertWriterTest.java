package io.github.yok.mongoclonelink.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import com.mongodb.MongoBulkWriteException;
import com.mongodb.ServerAddress;
import com.mongodb.bulk.BulkWriteError;
import com.mongodb.bulk.BulkWriteResult;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.BulkWriteOptions;
import com.mongodb.client.model.ReplaceOneModel;
import com.mongodb.client.model.WriteModel;
import io.github.yok.mongoclonelink.exception.BatchWriteException;
import io.github.yok.mongoclonelink.exception.DocumentDecodeException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonString;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class BatchUpsertWriterTest {

    private MongoCollection<BsonDocument> collection;

    private List<String> lines;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setup() {
        collection = mock(MongoCollection.class);
        lines = new ArrayList<>();
    }

    private static BsonDocument doc(int id) {
        return new BsonDocument("_id", new BsonInt32(id)).append("name",
                new BsonString("user" + id));
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private List<List<WriteModel<BsonDocument>>> capturedBatches(int expectedCalls) {
        ArgumentCaptor<List> captor = ArgumentCaptor.forClass(List.class);
        verify(collection, times(expectedCalls)).bulkWrite(captor.capture(),
                any(BulkWriteOptions.class));
        List<List<WriteModel<BsonDocument>>> batches = new ArrayList<>();
        for (List batch : captor.getAllValues()) {
            batches.add(batch);
        }
        return batches;
    }

    @Test
    void コンストラクタ_異常ケース_バッチサイズ0を指定する_IllegalArgumentExceptionが送出されること() {
        assertThrows(IllegalArgumentException.class,
                () -> new BatchUpsertWriter("users", collection, 0, lines::add));
    }

    @Test
    void add_正常ケース_閾値ちょうどの件数を追加する_一括書込みが1回だけ行われること() {
        BatchUpsertWriter writer = new BatchUpsertWriter("users", collection, 3, lines::add);
        for (int i = 1; i <= 3; i++) {
            writer.add(doc(i));
        }

        assertEquals(0, writer.getPendingCount());
        assertEquals(3L, writer.finish());

        List<List<WriteModel<BsonDocument>>> batches = capturedBatches(1);
        assertEquals(3, batches.get(0).size());
        assertEquals(1, writer.getFlushCount());
        assertEquals(List.of("  [users] Processed 3 documents (upserts)...",
                "  Finished users with 3 documents."), lines);
    }

    @Test
    void add_正常ケース_閾値より1件多く追加する_2回目の書込みが1件であること() {
        BatchUpsertWriter writer = new BatchUpsertWriter("users", collection, 3, lines::add);
        for (int i = 1; i <= 4; i++) {
            writer.add(doc(i));
        }
        assertEquals(1, writer.getPendingCount());

        assertEquals(4L, writer.finish());

        List<List<WriteModel<BsonDocument>>> batches = capturedBatches(2);
        assertEquals(3, batches.get(0).size());
        assertEquals(1, batches.get(1).size());
        assertTrue(lines.contains("  [users] Processed 3 documents (upserts)..."));
        assertTrue(lines.contains("  [users] Processed 4 documents (upserts)..."));
    }

    @Test
    void add_正常ケース_閾値より1件少なく追加する_finishで1回だけ書込まれること() {
        BatchUpsertWriter writer = new BatchUpsertWriter("users", collection, 3, lines::add);
        writer.add(doc(1));
        writer.add(doc(2));
        verify(collection, never()).bulkWrite(anyList(), any(BulkWriteOptions.class));

        assertEquals(2L, writer.finish());

        List<List<WriteModel<BsonDocument>>> batches = capturedBatches(1);
        assertEquals(2, batches.get(0).size());
    }

    @Test
    @SuppressWarnings("unchecked")
    void add_正常ケース_ドキュメントを追加する_id条件のupsert置換で無順序書込みされること() {
        BatchUpsertWriter writer = new BatchUpsertWriter("users", collection, 10, lines::add);
        BsonDocument document = doc(7);
        writer.add(document);
        writer.flush();

        ArgumentCaptor<BulkWriteOptions> options = ArgumentCaptor.forClass(BulkWriteOptions.class);
        verify(collection).bulkWrite(anyList(), options.capture());
        assertFalse(options.getValue().isOrdered());

        ReplaceOneModel<BsonDocument> model =
                (ReplaceOneModel<BsonDocument>) capturedBatches(1).get(0).get(0);
        assertEquals(new BsonDocument("_id", new BsonInt32(7)), model.getFilter());
        assertSame(document, model.getReplacement());
        assertTrue(model.getReplaceOptions().isUpsert());
    }

    @Test
    void flush_正常ケース_保留なしで呼び出す_書込みが行われないこと() {
        BatchUpsertWriter writer = new BatchUpsertWriter("users", collection, 3, lines::add);

        writer.flush();

        verify(collection, never()).bulkWrite(anyList(), any(BulkWriteOptions.class));
        assertTrue(lines.isEmpty());
    }

    @Test
    void finish_正常ケース_ドキュメントなしで呼び出す_0件の完了行が出力されること() {
        BatchUpsertWriter writer = new BatchUpsertWriter("empty", collection, 3, lines::add);

        assertEquals(0L, writer.finish());

        verify(collection, never()).bulkWrite(anyList(), any(BulkWriteOptions.class));
        assertEquals(List.of("  Finished empty with 0 documents."), lines);
    }

    @Test
    void add_異常ケース_idなしのドキュメントを追加する_DocumentDecodeExceptionが送出されること() {
        BatchUpsertWriter writer = new BatchUpsertWriter("users", collection, 3, lines::add);

        assertThrows(DocumentDecodeException.class,
                () -> writer.add(new BsonDocument("name", new BsonString("nobody"))));
        assertEquals(0, writer.getPendingCount());
    }

    @Test
    void flush_異常ケース_一括書込みが失敗する_BatchWriteExceptionが送出されること() {
        MongoBulkWriteException failure = new MongoBulkWriteException(
                BulkWriteResult.unacknowledged(),
                List.of(new BulkWriteError(121, "Document failed validation", new BsonDocument(),
                        0)),
                null, new ServerAddress(), Collections.<String>emptySet());
        when(collection.bulkWrite(anyList(), any(BulkWriteOptions.class))).thenThrow(failure);
        BatchUpsertWriter writer = new BatchUpsertWriter("users", collection, 2, lines::add);
        writer.add(doc(1));

        BatchWriteException ex = assertThrows(BatchWriteException.class, () -> writer.add(doc(2)));

        assertEquals("users", ex.getCollectionName());
        assertEquals(1, ex.getFailedCount());
        assertSame(failure, ex.getCause());
        assertEquals(0L, writer.getTotal());
        assertTrue(lines.isEmpty());
    }

    @Test
    void add_正常ケース_進捗先がnullの場合_例外なく書込まれること() {
        BatchUpsertWriter writer = new BatchUpsertWriter("users", collection, 1, null);

        writer.add(doc(1));

        assertEquals(1L, writer.getTotal());
        assertTrue(lines.isEmpty());
    }

    @Test
    void コンストラクタ_正常ケース_非常に大きいバッチサイズを指定する_少量でも書込みできること() {
        BatchUpsertWriter writer =
                new BatchUpsertWriter("users", collection, Integer.MAX_VALUE, lines::add);

        writer.add(doc(1));

        assertEquals(1, writer.getPendingCount());
        assertEquals(1L, writer.finish());
        assertEquals(1, capturedBatches(1).get(0).size());
    }
}

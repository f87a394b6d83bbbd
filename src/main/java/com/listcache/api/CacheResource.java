package com.listcache.api;

import com.listcache.core.ListCache;
import com.listcache.core.model.EvictionReport;
import com.listcache.posting.PostingList;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Önbelleği HTTP üzerinden incelemek ve yönetmek için sağlanan REST kaynağı.
 * Posting list okuma, yoksa ekleme, değişiklik kaydetme ve kalıcılaştırma,
 * yönetimsel silme ile shard doluluklarının izlenmesini sağlar.
 */
@Path("/cache")
@ApplicationScoped
@Consumes(MediaType.APPLICATION_JSON)
@Produces(MediaType.APPLICATION_JSON)
public class CacheResource {

    // Yönetim uçları bu önekle başlar; bu önekle anahtar saklanamaz.
    static final String RESERVED_PREFIX = "_";

    private final ListCache<PostingList> cache;

    @Inject
    public CacheResource(ListCache<PostingList> cache) {
        this.cache = cache;
    }

    @GET
    @Path("{key}")
    public Response get(@PathParam("key") String key) {
        PostingList list = cache.get(key);
        if (list == null) {
            return notFound();
        }
        return Response.ok(PostingListView.of(list)).build();
    }

    @PUT
    @Path("{key}")
    public Response putIfMissing(@PathParam("key") String key, PostingListWriteRequest request) {
        if (key.startsWith(RESERVED_PREFIX)) {
            return badRequest("Keys starting with '" + RESERVED_PREFIX + "' are reserved");
        }
        if (request == null || request.uids() == null) {
            return badRequest("uids must be provided");
        }
        if (request.uids().contains(null)) {
            return badRequest("uids must not contain null");
        }
        PostingList stored = cache.putIfMissing(key, new PostingList(key, request.uids()));
        return Response.ok(PostingListView.of(stored)).build();
    }

    @POST
    @Path("{key}/mutations")
    public Response addMutation(@PathParam("key") String key, MutationRequest request) {
        if (request == null || request.uid() == null || request.op() == null) {
            return badRequest("uid and op must be provided");
        }
        PostingList list = cache.get(key);
        if (list == null) {
            return notFound();
        }
        if (!list.addMutation(request.uid(), request.op())) {
            return Response.status(Response.Status.CONFLICT)
                    .entity(new ErrorResponse("Posting list is marked for deletion"))
                    .build();
        }
        return Response.accepted(PostingListView.of(list)).build();
    }

    @POST
    @Path("{key}/commit")
    public Response commit(@PathParam("key") String key) {
        PostingList list = cache.get(key);
        if (list == null) {
            return notFound();
        }
        return Response.ok(new CommitResponse(key, list.commit())).build();
    }

    @DELETE
    @Path("{key}")
    public Response delete(@PathParam("key") String key) {
        if (!cache.delete(key)) {
            return notFound();
        }
        return Response.noContent().build();
    }

    @GET
    @Path("_shards")
    public Response shards() {
        List<Integer> sizes = new ArrayList<>(ListCache.SHARD_COUNT);
        int total = 0;
        for (int i = 0; i < ListCache.SHARD_COUNT; i++) {
            int size = cache.shardSize(i);
            sizes.add(size);
            total += size;
        }
        return Response.ok(new ShardOccupancy(ListCache.SHARD_COUNT, cache.shardCapacity(), sizes, total)).build();
    }

    @POST
    @Path("_shards/{index}/evict")
    public Response evict(@PathParam("index") int index) {
        if (index < 0 || index >= ListCache.SHARD_COUNT) {
            return Response.status(Response.Status.NOT_FOUND)
                    .entity(new ErrorResponse("Shard not found"))
                    .build();
        }
        EvictionReport report = cache.evictShard(index);
        return Response.ok(report).build();
    }

    private static Response notFound() {
        return Response.status(Response.Status.NOT_FOUND)
                .entity(new ErrorResponse("Key not found"))
                .build();
    }

    private static Response badRequest(String message) {
        return Response.status(Response.Status.BAD_REQUEST)
                .entity(new ErrorResponse(message))
                .build();
    }

    public record PostingListView(String key, List<Long> uids, int pendingMutations, boolean markedForDeletion) {
        static PostingListView of(PostingList list) {
            return new PostingListView(list.key(), list.uids(), list.pendingMutations(), list.isMarkedForDeletion());
        }
    }

    public record MutationRequest(Long uid, PostingList.Op op) {}

    public record CommitResponse(String key, int applied) {}

    public record ShardOccupancy(int shardCount, int capacity, List<Integer> sizes, int total) {}

    public record ErrorResponse(String message) {}

    public static final class PostingListWriteRequest {
        private List<Long> uids;

        public PostingListWriteRequest() {
        }

        public PostingListWriteRequest(List<Long> uids) {
            this.uids = uids;
        }

        public List<Long> uids() {
            return uids;
        }

        public void setUids(List<Long> uids) {
            this.uids = uids;
        }

        @Override
        public String toString() {
            return "PostingListWriteRequest{uids=" + uids + '}';
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(uids);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            PostingListWriteRequest that = (PostingListWriteRequest) o;
            return Objects.equals(uids, that.uids);
        }
    }
}

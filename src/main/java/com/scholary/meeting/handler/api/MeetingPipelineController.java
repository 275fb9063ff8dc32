package com.scholary.meeting.handler.api;

import com.scholary.meeting.handler.objectstore.ObjectStoreException;
import com.scholary.meeting.handler.service.SegmentationService;
import com.scholary.meeting.handler.service.TranscriptChunkingService;
import com.scholary.meeting.handler.service.TurnMergeService;
import com.scholary.meeting.handler.service.TurnsDocument;
import com.scholary.meeting.handler.transcript.MissingChunkResultException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for the meeting transcript pipeline.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Chunking a stored transcript, or previewing chunk boundaries of inline text
 *   <li>Submitting one chunk's analysis result
 *   <li>Merging chunk results into one turns document
 *   <li>Grouping turns into segments
 * </ul>
 *
 * <p>A missing chunk result is reported as 422, object store failures as 502.
 */
@RestController
@Tag(name = "Meeting pipeline", description = "Transcript chunking, merging and segmentation API")
public class MeetingPipelineController {

  private static final Logger LOGGER = LoggerFactory.getLogger(MeetingPipelineController.class);

  private final TranscriptChunkingService chunkingService;
  private final TurnMergeService mergeService;
  private final SegmentationService segmentationService;

  public MeetingPipelineController(
      TranscriptChunkingService chunkingService,
      TurnMergeService mergeService,
      SegmentationService segmentationService) {
    this.chunkingService = chunkingService;
    this.mergeService = mergeService;
    this.segmentationService = segmentationService;
  }

  @PostMapping("/api/chunk")
  @Operation(
      summary = "Chunk transcript",
      description = "Split a stored transcript into overlapping chunks and write chunk metadata")
  public ResponseEntity<ChunkResponse> chunk(@Valid @RequestBody ChunkRequest request) {
    try {
      LOGGER.info("Chunk request: meetingId={}, key={}", request.meetingId(), request.inputKey());
      ChunkResponse response =
          chunkingService.chunk(request.meetingId(), request.inputKey(), request.outputPrefix());
      return ResponseEntity.ok(response);
    } catch (ObjectStoreException e) {
      LOGGER.error("Object store failure while chunking {}", request.meetingId(), e);
      return ResponseEntity.status(HttpStatus.BAD_GATEWAY).build();
    } catch (Exception e) {
      LOGGER.error("Failed to chunk transcript for {}", request.meetingId(), e);
      return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
    }
  }

  /**
   * Preview chunk boundaries without writing anything.
   *
   * <p>Useful for tuning chunk size and overlap against a real transcript.
   */
  @PostMapping("/api/chunk/preview")
  @Operation(
      summary = "Preview chunks",
      description = "Show where inline text would be split, without touching storage")
  public ResponseEntity<ChunkPreviewResponse> preview(
      @Valid @RequestBody ChunkPreviewRequest request) {
    try {
      return ResponseEntity.ok(
          chunkingService.preview(
              request.text(), request.chunkSizeTokens(), request.overlapTokens()));
    } catch (IllegalArgumentException e) {
      LOGGER.warn("Invalid preview parameters: {}", e.getMessage());
      return ResponseEntity.badRequest().build();
    }
  }

  @PutMapping("/api/meetings/{meetingId}/chunks/{chunkIndex}/turns")
  @Operation(
      summary = "Submit chunk result",
      description = "Store the turns produced for one chunk until the merge runs")
  public ResponseEntity<ChunkResultAck> submitChunkResult(
      @PathVariable String meetingId,
      @PathVariable int chunkIndex,
      @RequestBody TurnsDocument document) {
    try {
      int kept = mergeService.submitChunkResult(meetingId, chunkIndex, document.turns());
      return ResponseEntity.accepted().body(new ChunkResultAck(meetingId, chunkIndex, kept));
    } catch (IllegalArgumentException e) {
      LOGGER.warn("Rejected chunk result for {}: {}", meetingId, e.getMessage());
      return ResponseEntity.badRequest().build();
    }
  }

  @PostMapping("/api/merge")
  @Operation(
      summary = "Merge chunk results",
      description = "Merge per-chunk turns into one de-duplicated, re-indexed turns document")
  public ResponseEntity<MergeResponse> merge(@Valid @RequestBody MergeRequest request) {
    try {
      LOGGER.info(
          "Merge request: meetingId={}, chunked={}", request.meetingId(), request.chunked());
      return ResponseEntity.ok(mergeService.merge(request));
    } catch (MissingChunkResultException e) {
      LOGGER.error("Cannot merge {}: {}", request.meetingId(), e.getMessage());
      return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).build();
    } catch (ObjectStoreException e) {
      LOGGER.error("Object store failure while merging {}", request.meetingId(), e);
      return ResponseEntity.status(HttpStatus.BAD_GATEWAY).build();
    } catch (IllegalArgumentException e) {
      LOGGER.warn("Invalid merge request for {}: {}", request.meetingId(), e.getMessage());
      return ResponseEntity.badRequest().build();
    } catch (Exception e) {
      LOGGER.error("Failed to merge chunk results for {}", request.meetingId(), e);
      return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
    }
  }

  @PostMapping("/api/segments")
  @Operation(
      summary = "Segment turns",
      description = "Group consecutive turns into segments under a token ceiling")
  public ResponseEntity<SegmentResponse> segment(@Valid @RequestBody SegmentRequest request) {
    try {
      return ResponseEntity.ok(segmentationService.segment(request));
    } catch (ObjectStoreException e) {
      LOGGER.error("Object store failure while segmenting {}", request.meetingId(), e);
      return ResponseEntity.status(HttpStatus.BAD_GATEWAY).build();
    } catch (Exception e) {
      LOGGER.error("Failed to segment turns for {}", request.meetingId(), e);
      return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
    }
  }
}

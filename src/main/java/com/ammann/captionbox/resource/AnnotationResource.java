/* (C)2026 */
package com.ammann.captionbox.resource;

import com.ammann.captionbox.dto.AnnotationRequestDTO;
import com.ammann.captionbox.dto.BoxRegistrationDTO;
import com.ammann.captionbox.dto.PredictionDTO;
import com.ammann.captionbox.dto.StreamingUpdateResultDTO;
import com.ammann.captionbox.enumeration.BoxLabel;
import com.ammann.captionbox.exception.DimensionMismatchException;
import com.ammann.captionbox.exception.ValidationException;
import com.ammann.captionbox.model.Annotation;
import com.ammann.captionbox.model.BoxRef;
import com.ammann.captionbox.model.BoxWithPrediction;
import com.ammann.captionbox.model.FeatureVector;
import com.ammann.captionbox.model.Prediction;
import com.ammann.captionbox.properties.ApiProperties;
import com.ammann.captionbox.repository.BoxPredictionRepository;
import com.ammann.captionbox.repository.ModelRepository;
import com.ammann.captionbox.service.BayesianPredictionService;
import com.ammann.captionbox.service.StreamingUpdateService;
import io.smallrye.mutiny.Uni;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

/**
 * REST resource for registering scored boxes and applying user annotations.
 *
 * <p>Each annotation stores the user's label, possibly retrains the model and re-scores the
 * boxes most likely to change.
 */
@Path(ApiProperties.BASE_URL_V1)
@Tag(name = "Annotation API", description = "Box registration and incremental reclassification")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class AnnotationResource {

    private static final Logger LOG = Logger.getLogger(AnnotationResource.class);

    @Inject StreamingUpdateService streamingUpdateService;

    @Inject BayesianPredictionService predictionService;

    @Inject BoxPredictionRepository boxRepository;

    @Inject ModelRepository modelRepository;

    @POST
    @Path(ApiProperties.Boxes.BASE)
    @Operation(
            summary = "Register box",
            description = "Stores an OCR box with its feature vector and scores it with the current model")
    @APIResponses({
            @APIResponse(responseCode = "201", description = "Box registered",
                    content = @Content(schema = @Schema(implementation = PredictionDTO.class))),
            @APIResponse(responseCode = "400", description = "Missing identifiers or wrong feature count")
    })
    public Response registerBox(BoxRegistrationDTO request) {
        if (request == null) {
            throw new ValidationException("Request body is required");
        }
        BoxRef boxRef = toBoxRef(request.frameIndex(), request.boxIndex());
        FeatureVector features = toFeatures(request.features());

        Prediction prediction =
                predictionService.predictFromFeatures(features, modelRepository.loadCurrentModel());
        BoxWithPrediction box = new BoxWithPrediction(boxRef, features, prediction);
        boxRepository.save(box);

        LOG.debugf("Registered box %s: %s (%.3f)", boxRef, prediction.label(), prediction.confidence());
        return Response.status(Response.Status.CREATED).entity(PredictionDTO.from(box)).build();
    }

    @GET
    @Path(ApiProperties.Boxes.UNCERTAIN)
    @Operation(
            summary = "Uncertain boxes",
            description = "Registered boxes whose prediction confidence is below the threshold, "
                    + "the best candidates for the next annotation")
    @APIResponse(responseCode = "200", description = "Uncertain boxes in frame order")
    public Response getUncertainBoxes(
            @Parameter(description = "Confidence threshold (default: 0.6)")
            @QueryParam("threshold") Double threshold) {
        if (threshold != null && (threshold < 0.0 || threshold > 1.0)) {
            throw ValidationException.invalidParameter("threshold", threshold, "a value in [0, 1]");
        }

        List<BoxWithPrediction> boxes = boxRepository.findAll();
        List<Prediction> predictions = boxes.stream().map(BoxWithPrediction::currentPrediction).toList();
        List<Integer> indices =
                threshold == null
                        ? predictionService.uncertainIndices(predictions)
                        : predictionService.uncertainIndices(predictions, threshold);

        List<PredictionDTO> uncertain = indices.stream().map(i -> PredictionDTO.from(boxes.get(i))).toList();
        return Response.ok(uncertain).build();
    }

    @GET
    @Path(ApiProperties.Boxes.CONFIDENT)
    @Operation(
            summary = "Confident boxes",
            description = "Registered boxes whose prediction confidence is at least the threshold")
    @APIResponse(responseCode = "200", description = "Confident boxes in frame order")
    public Response getConfidentBoxes(
            @Parameter(description = "Confidence threshold (default: 0.7)")
            @QueryParam("threshold") Double threshold) {
        if (threshold != null && (threshold < 0.0 || threshold > 1.0)) {
            throw ValidationException.invalidParameter("threshold", threshold, "a value in [0, 1]");
        }

        List<BoxWithPrediction> boxes = boxRepository.findAll();
        List<Prediction> predictions = boxes.stream().map(BoxWithPrediction::currentPrediction).toList();
        List<Integer> indices =
                threshold == null
                        ? predictionService.confidentIndices(predictions)
                        : predictionService.confidentIndices(predictions, threshold);

        return Response.ok(indices.stream().map(i -> PredictionDTO.from(boxes.get(i))).toList()).build();
    }

    @POST
    @Path(ApiProperties.Boxes.ANNOTATIONS)
    @Operation(
            summary = "Annotate box",
            description = "Stores a user label for a box and re-scores the boxes it is likely to affect")
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Annotation applied",
                    content = @Content(schema = @Schema(implementation = StreamingUpdateResultDTO.class))),
            @APIResponse(responseCode = "400", description = "Unknown box, unknown label or wrong feature count"),
            @APIResponse(responseCode = "503", description = "Retrained model could not be stored")
    })
    public Response annotate(AnnotationRequestDTO request) {
        Annotation annotation = toAnnotation(request);
        return Response.ok(StreamingUpdateResultDTO.from(streamingUpdateService.applyAnnotation(annotation)))
                .build();
    }

    @POST
    @Path(ApiProperties.Boxes.ANNOTATIONS_ASYNC)
    @Operation(
            summary = "Annotate box (batched re-scoring)",
            description = "Same as annotate, but re-scores batch by batch on the recalculation executor")
    @APIResponse(responseCode = "200", description = "Annotation applied",
            content = @Content(schema = @Schema(implementation = StreamingUpdateResultDTO.class)))
    public Uni<Response> annotateAsync(AnnotationRequestDTO request) {
        Annotation annotation = toAnnotation(request);
        return streamingUpdateService
                .applyAnnotationAsync(annotation)
                .map(result -> Response.ok(StreamingUpdateResultDTO.from(result)).build());
    }

    private Annotation toAnnotation(AnnotationRequestDTO request) {
        if (request == null) {
            throw new ValidationException("Request body is required");
        }
        BoxRef boxRef = toBoxRef(request.frameIndex(), request.boxIndex());

        BoxLabel label;
        try {
            label = BoxLabel.fromValue(request.label());
        } catch (IllegalArgumentException e) {
            throw ValidationException.invalidParameter("label", request.label(), "'in' or 'out'");
        }

        FeatureVector features =
                request.features() != null
                        ? toFeatures(request.features())
                        : boxRepository
                                .find(boxRef)
                                .map(BoxWithPrediction::features)
                                .orElseThrow(() -> ValidationException.unknownResource("box", boxRef));

        return new Annotation(boxRef, label, features);
    }

    private static BoxRef toBoxRef(Integer frameIndex, Integer boxIndex) {
        if (frameIndex == null || frameIndex < 0) {
            throw ValidationException.invalidParameter("frameIndex", frameIndex, "a non-negative integer");
        }
        if (boxIndex == null || boxIndex < 0) {
            throw ValidationException.invalidParameter("boxIndex", boxIndex, "a non-negative integer");
        }
        return new BoxRef(frameIndex, boxIndex);
    }

    private static FeatureVector toFeatures(List<Double> values) {
        if (values != null && values.contains(null)) {
            throw new ValidationException("Invalid feature vector: null values are not allowed");
        }
        try {
            return FeatureVector.of(values);
        } catch (DimensionMismatchException e) {
            throw new ValidationException("Invalid feature vector: " + e.getMessage(), e);
        }
    }
}

/* (C)2026 */
package com.ammann.captionbox.resource;

import com.ammann.captionbox.dto.FeatureImportanceDTO;
import com.ammann.captionbox.dto.ModelSummaryDTO;
import com.ammann.captionbox.dto.TrainingDataDTO;
import com.ammann.captionbox.dto.TrainingResultDTO;
import com.ammann.captionbox.model.BoxClassificationModel;
import com.ammann.captionbox.model.FisherScore;
import com.ammann.captionbox.model.TrainingResult;
import com.ammann.captionbox.properties.ApiProperties;
import com.ammann.captionbox.repository.ModelRepository;
import com.ammann.captionbox.service.ModelTrainingService;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.Comparator;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

/**
 * REST resource for inspecting and training the box classification model.
 */
@Path(ApiProperties.BASE_URL_V1)
@Tag(name = "Model API", description = "Caption box classification model")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ModelResource {

    private static final Logger LOG = Logger.getLogger(ModelResource.class);

    @Inject ModelTrainingService trainingService;

    @Inject ModelRepository modelRepository;

    @GET
    @Path(ApiProperties.Model.BASE)
    @Operation(summary = "Current model", description = "Returns a summary of the model currently in use")
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Model summary",
                    content = @Content(schema = @Schema(implementation = ModelSummaryDTO.class))),
            @APIResponse(responseCode = "404", description = "No model has been initialized")
    })
    public Response getModel() {
        return Response.ok(ModelSummaryDTO.from(currentModel())).build();
    }

    @GET
    @Path(ApiProperties.Model.FEATURE_IMPORTANCE)
    @Operation(
            summary = "Feature importance",
            description = "Fisher scores of the current model, most discriminative feature first. "
                    + "Empty until the model was trained on enough annotations.")
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Feature importance list"),
            @APIResponse(responseCode = "404", description = "No model has been initialized")
    })
    public Response getFeatureImportance() {
        List<FeatureImportanceDTO> importance =
                currentModel().getFeatureImportance().orElse(List.of()).stream()
                        .sorted(Comparator.comparingDouble(FisherScore::fisherScore).reversed())
                        .map(FeatureImportanceDTO::from)
                        .toList();
        return Response.ok(importance).build();
    }

    @POST
    @Path(ApiProperties.Model.TRAIN)
    @Operation(
            summary = "Train model",
            description = "Trains a new model from all user annotations. Reverts to the seed model "
                    + "when annotations dropped below the training minimum.")
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Training finished or skipped",
                    content = @Content(schema = @Schema(implementation = TrainingResultDTO.class))),
            @APIResponse(responseCode = "503", description = "Model could not be stored")
    })
    public Response train() {
        TrainingResult result = trainingService.train();

        boolean reset = false;
        if (result.resetToSeedRequired()) {
            trainingService.resetToSeedModel();
            reset = true;
        }

        LOG.infof("Training requested: status=%s, reset=%b", result.status(), reset);
        return Response.ok(TrainingResultDTO.from(result, reset)).build();
    }

    @POST
    @Path(ApiProperties.Model.SEED)
    @Operation(
            summary = "Initialize seed model",
            description = "Installs the seed model if no model exists yet. Repeated calls have no effect.")
    @APIResponse(responseCode = "200", description = "Current model after initialization",
            content = @Content(schema = @Schema(implementation = ModelSummaryDTO.class)))
    public Response initializeSeed() {
        trainingService.initializeSeedModel();
        return Response.ok(ModelSummaryDTO.from(currentModel())).build();
    }

    @GET
    @Path(ApiProperties.Model.TRAINING_DATA)
    @Operation(
            summary = "Training data",
            description = "Per-class sample counts the next training run would use. "
                    + "Not ready while annotations or per-class samples are below the minimum.")
    @APIResponse(responseCode = "200", description = "Training data summary",
            content = @Content(schema = @Schema(implementation = TrainingDataDTO.class)))
    public Response getTrainingData() {
        TrainingDataDTO body =
                trainingService
                        .loadTrainingSamples()
                        .map(samples -> TrainingDataDTO.of(samples.get(0).n(), samples.get(1).n()))
                        .orElseGet(TrainingDataDTO::notReady);
        return Response.ok(body).build();
    }

    private BoxClassificationModel currentModel() {
        return modelRepository
                .loadCurrentModel()
                .orElseThrow(() -> new NotFoundException("No classification model available"));
    }
}

package dev.konduit.config;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.allminilml6v2.AllMiniLmL6V2EmbeddingModel;
import dev.langchain4j.model.scoring.ScoringModel;
import dev.langchain4j.model.scoring.onnx.OnnxScoringModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configures the two model capabilities behind the retrieval engine.
 *
 * <p>Both models run in-process through ONNX Runtime: the all-MiniLM-L6-v2 bi-encoder (384
 * dimensions) produces chunk and query vectors, and the ms-marco-MiniLM-L-6-v2 cross-encoder
 * scores (query, chunk) pairs for the second-stage rerank.
 *
 * @see dev.konduit.index.SearchIndex
 * @see dev.konduit.search.RerankerService
 */
@Configuration
public class EmbeddingConfig {

    /**
     * Provides the in-process bi-encoder used for chunk and query embeddings.
     *
     * @return a ready-to-use embedding model requiring no external API
     */
    @Bean
    public EmbeddingModel embeddingModel() {
        return new AllMiniLmL6V2EmbeddingModel();
    }

    /**
     * Provides the cross-encoder scoring model used for reranking.
     *
     * @param modelPath     path to the ONNX model file
     * @param tokenizerPath path to the tokenizer JSON file
     * @return a scoring model for pairwise (query, text) relevance
     */
    @Bean
    public ScoringModel scoringModel(
            @Value("${konduit.reranker.model-path}") String modelPath,
            @Value("${konduit.reranker.tokenizer-path}") String tokenizerPath) {
        return new OnnxScoringModel(modelPath, tokenizerPath);
    }
}

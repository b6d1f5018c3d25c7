package com.nim.gateway.model;

import com.nim.gateway.config.AppProperties;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 模型目录
 * <p>
 * 将 OpenAI 模型名（如 gpt-4, claude-3-opus）映射为 NIM 模型 ID，
 * 并维护 NIM 模型的 thinking 能力表
 */
@Component
public class ModelCatalog {

    private static final Logger log = LoggerFactory.getLogger(ModelCatalog.class);

    private static final String NEMOTRON_ULTRA = "nvidia/llama-3.1-nemotron-ultra-253b-v1";
    private static final String QWEN3 = "qwen/qwen3-235b-a22b";
    private static final String DEEPSEEK_R1 = "deepseek-ai/deepseek-r1-0528";

    private static final String[][] DEFAULT_MAPPINGS = {
            {"gpt-3.5-turbo", NEMOTRON_ULTRA},
            {"gpt-4", QWEN3},
            {"gpt-4-turbo", DEEPSEEK_R1},
            {"gpt-4o", "deepseek-ai/deepseek-v3"},
            {"gpt-4o-mini", "meta/llama-3.3-70b-instruct"},
            {"claude-3-opus", NEMOTRON_ULTRA},
            {"claude-3-sonnet", QWEN3},
            {"claude-3-haiku", "deepseek-ai/deepseek-r1-distill-qwen-32b"},
            {"gemini-pro", DEEPSEEK_R1},
    };

    private static final Map<String, Set<ModelCapability>> DEFAULT_CAPABILITIES = Map.of(
            DEEPSEEK_R1, EnumSet.of(ModelCapability.NATIVE_REASONING),
            "deepseek-ai/deepseek-r1-distill-qwen-32b", EnumSet.of(ModelCapability.NATIVE_REASONING),
            "deepseek-ai/deepseek-r1-distill-qwen-14b", EnumSet.of(ModelCapability.NATIVE_REASONING),
            "deepseek-ai/deepseek-r1-distill-llama-8b", EnumSet.of(ModelCapability.NATIVE_REASONING),
            QWEN3, EnumSet.of(ModelCapability.TEMPLATE_THINKING),
            "qwen/qwen3-coder-480b-a35b-instruct", EnumSet.of(ModelCapability.TEMPLATE_THINKING),
            NEMOTRON_ULTRA, EnumSet.of(ModelCapability.SYSTEM_PROMPT_THINKING)
    );

    private final AppProperties properties;

    // 客户端模型名 → NIM 模型 ID（保持插入顺序，用于 /v1/models）
    private final Map<String, String> mappings = new LinkedHashMap<>();

    public ModelCatalog(AppProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        for (String[] m : DEFAULT_MAPPINGS) {
            mappings.put(m[0], m[1]);
        }
        Map<String, String> overrides = properties.getModelMapping();
        if (overrides != null && !overrides.isEmpty()) {
            mappings.putAll(overrides);
            log.info("已加载 {} 条自定义模型映射", overrides.size());
        }
        log.info("模型目录初始化完成: {} 个模型别名, {} 个 thinking 模型", mappings.size(), DEFAULT_CAPABILITIES.size());
    }

    /**
     * 解析客户端模型名 → NIM 模型 ID，未映射时原样透传
     */
    public String resolve(String requestedModel) {
        if (requestedModel == null) {
            return null;
        }
        String nimModel = mappings.get(requestedModel);
        if (nimModel == null) {
            log.debug("模型 '{}' 未找到映射，原样透传", requestedModel);
            return requestedModel;
        }
        return nimModel;
    }

    /**
     * 查询 NIM 模型的能力标记
     */
    public Set<ModelCapability> capabilities(String nimModel) {
        if (nimModel == null) {
            return Collections.emptySet();
        }
        Set<ModelCapability> caps = DEFAULT_CAPABILITIES.get(nimModel);
        return caps != null ? Collections.unmodifiableSet(caps) : Collections.emptySet();
    }

    public boolean supports(String nimModel, ModelCapability capability) {
        return capabilities(nimModel).contains(capability);
    }

    /**
     * 所有客户端可见的模型名（用于 /v1/models 端点）
     */
    public List<String> listAliases() {
        return new ArrayList<>(mappings.keySet());
    }
}

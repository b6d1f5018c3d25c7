package com.nim.gateway.model;

/**
 * NIM 模型的 thinking 能力标记
 */
public enum ModelCapability {

    /**
     * 原生输出 reasoning，无需额外参数（DeepSeek R1 系列）
     */
    NATIVE_REASONING,

    /**
     * 通过 chat_template_kwargs.enable_thinking 开启（Qwen3 系列）
     */
    TEMPLATE_THINKING,

    /**
     * 通过 system 提示词前缀开启（Nemotron Ultra）
     */
    SYSTEM_PROMPT_THINKING
}

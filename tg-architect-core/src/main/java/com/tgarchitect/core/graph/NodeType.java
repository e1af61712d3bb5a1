package com.tgarchitect.core.graph;

/**
 * Kinds of graph node produced from a Terragrunt repository.
 */
public enum NodeType {
    /** One {@code terragrunt.hcl} file. */
    TG_CONFIG("tg_config"),
    /** Synthetic node standing for a Terraform module referenced by {@code terraform.source}. */
    TERRAFORM_MODULE("terraform_module");

    private final String wireName;

    NodeType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}

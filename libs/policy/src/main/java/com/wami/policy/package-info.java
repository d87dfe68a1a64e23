/**
 * IAM-style policy documents and their evaluation.
 *
 * <p>{@link com.wami.policy.PolicyEvaluationEngine} is a pure function of documents, action and
 * resource. Storage is reached only through {@link com.wami.policy.store.PolicyStore}.
 */
package com.wami.policy;

/**
 * Generation 领域 - 文案与图片生成编排
 *
 * <p>只负责调用外部生成服务（带超时与重试），不写草稿存储。</p>
 */
package com.poststudio.domain.generation;

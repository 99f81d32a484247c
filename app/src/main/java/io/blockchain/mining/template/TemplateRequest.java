package io.blockchain.mining.template;

/**
 * Parsed {@code getblocktemplate} request.
 *
 * @param mode        "template", "proposal" or null for the default
 * @param longPoll    true if the request carried a {@code longpollid} key at all
 * @param longPollId  the id when it was a string, otherwise null
 * @param data        hex block for proposals, otherwise null
 */
public record TemplateRequest(String mode, boolean longPoll, String longPollId, String data) {

    public static TemplateRequest template() {
        return new TemplateRequest(null, false, null, null);
    }

    public static TemplateRequest longPoll(String longPollId) {
        return new TemplateRequest("template", true, longPollId, null);
    }

    public static TemplateRequest proposal(String hexBlock) {
        return new TemplateRequest("proposal", false, null, hexBlock);
    }
}

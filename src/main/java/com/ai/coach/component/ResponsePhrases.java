package com.ai.coach.component;

import com.ai.coach.conversation.checkpoint.CheckpointStep;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Coach wording. Methods returning lists are variant pools; the composer picks a
 * variant that was not asked recently.
 */
@Component
public class ResponsePhrases {

    private static final String[][] ANIMALS = {
            {"zebra", "lion"},
            {"gazelle", "cheetah"},
            {"deer", "wolf"}
    };

    public String opening() {
        return "Hi, I'm glad you're here. What would you like to feel by the end of our time together?";
    }

    public String safetyEscalation() {
        return "I'm really glad you told me. What you're feeling matters, and you deserve support from someone who can "
                + "be with you right now. Please contact your local emergency number or a crisis line straight away.";
    }

    public List<String> affirmations() {
        return List.of("Okay.", "Got it.", "I hear you.", "Thank you.", "Mm, that makes sense.");
    }

    public List<String> redirectPast() {
        return List.of(
                "That sounds like it mattered. Let's bring it to right now. As you think about it now, what do you notice?",
                "I hear that. Rather than going back there, let's stay with today. How does it feel right now?",
                "Thank you for sharing that. What's it like for you in this moment?"
        );
    }

    public List<String> redirectThinking() {
        return List.of(
                "I hear what you're thinking. Let's set the thinking aside for a moment. What do you feel right now?",
                "That makes sense as a thought. If you drop down from your head for a second, what do you notice?",
                "Let's leave the why for now. What are you feeling as we talk?"
        );
    }

    public List<String> outcomeMenu(String context, String goal) {
        List<String> pool = new ArrayList<>();
        switch (StringUtils.defaultString(context)) {
            case "goal":
                pool.add("That's okay, it can be hard to put into words. Some people want to feel calmer, lighter, "
                        + "more at ease or more in control. Does one of those fit for you?");
                break;
            case "feelings":
                pool.add("That's alright. What if you could feel lighter, more settled, maybe a little more peaceful? "
                        + "Which of those feels closest?");
                break;
            case "body":
                pool.add("That's okay, you don't need to know. What if your body could feel a bit looser, a bit lighter, "
                        + "more at ease? Which would you like most?");
                break;
            default:
                break;
        }
        String anchor = StringUtils.isNotBlank(goal) ? " and more " + goal : "";
        pool.add("That's okay. What if you could feel calmer" + anchor + ", lighter, at ease? "
                + "Which sounds best right now?");
        pool.add("That's fine, there's no wrong answer. Calmer, lighter, more settled, more at ease. "
                + "Which of those pulls at you?");
        pool.add("That's okay, we can find it together. If you had to choose between calm, relief or ease, "
                + "what would you pick?");
        return pool;
    }

    public List<String> clarifyGoal() {
        return List.of(
                "What would you like to feel instead?",
                "How would you like to be feeling by the end of our time together?",
                "If things were better for you, how would you be feeling?"
        );
    }

    public List<String> redirectOutcome() {
        return List.of(
                "That sounds really hard. And if that weren't weighing on you, how would you like to feel?",
                "Thanks for sharing that. If we could change how it leaves you feeling, what would you want to feel?",
                "I hear you. Underneath all of that, what would you love to feel more of?"
        );
    }

    public List<String> vision(String goal, boolean repeat) {
        String g = StringUtils.defaultIfBlank(goal, "better");
        if (repeat) {
            return List.of(
                    "Let me put it another way. Imagine yourself already feeling " + g
                            + ", with that weight lifted off you. How does that sound?",
                    "Picture a day where you wake up feeling " + g + " and it stays with you. Is that what you want?",
                    "Think of yourself moving through your day " + g + ", with nothing pulling at you. "
                            + "Would you like that?"
            );
        }
        return List.of(
                "Got it. So you want to feel " + g + ". I'm seeing you who's " + g
                        + ", at ease, lighter. Does that make sense to you?",
                "Okay, so feeling " + g + " is what you're after. Picture yourself " + g
                        + ", settled and lighter. Can you see that?",
                "So you'd like to feel " + g + ". I'm imagining you " + g + " and easy in yourself. "
                        + "Does that feel right?"
        );
    }

    /** Pool rotated by {@code variant} so different sessions hear different animals first. */
    public List<String> psychoEducation(int variant) {
        String[] closings = {
                "Does that make sense?",
                "Does that fit with how it's been for you?",
                "Can you relate to that?"
        };
        List<String> pool = new ArrayList<>();
        for (int i = 0; i < ANIMALS.length; i++) {
            String[] pair = ANIMALS[Math.floorMod(variant + i, ANIMALS.length)];
            pool.add("Here's something that might help. When a " + pair[0] + " is chased by a " + pair[1]
                    + ", its body floods with stress so it can run. Once it's safe, it shakes it off and goes back to "
                    + "grazing. We have the same alarm, but with work, worries and deadlines it keeps ringing and we "
                    + "never get to shake it off. What we'll do together is help your body notice it's safe now. "
                    + closings[i]);
        }
        return pool;
    }

    public List<String> exploreProblem() {
        return List.of(
                "What's been making it hard for you?",
                "What's been getting in the way of feeling that way?",
                "What's been weighing on you lately?"
        );
    }

    public List<String> locationQuestions(String cue) {
        if (StringUtils.isNotBlank(cue)) {
            return List.of(
                    "When you notice that " + cue + ", where does it show up in your body?",
                    "Where do you feel that " + cue + " in your body?",
                    "Where in your body is that " + cue + " sitting right now?"
            );
        }
        return List.of(
                "Where do you feel that in your body?",
                "Where in your body do you notice it most?",
                "If you check in with your body, where does it show up?"
        );
    }

    public List<String> sensationQuestions(String location) {
        if (StringUtils.isNotBlank(location)) {
            return List.of(
                    "And what's it like in your " + location + "? Tight, heavy, something else?",
                    "How would you describe that feeling in your " + location + "?",
                    "What kind of sensation is it there in your " + location + "?"
            );
        }
        return List.of(
                "What's the feeling like? Tight, heavy, something else?",
                "How would you describe that sensation?",
                "What kind of sensation is it?"
        );
    }

    public List<String> presentMoment() {
        return List.of(
                "How are you feeling now, as you notice it?",
                "As we talk about it right now, what do you notice in your body?",
                "What's happening in your body right now?"
        );
    }

    public List<String> readinessEscape() {
        return List.of(
                "Let's pause there for a moment. Right now, in this moment, how are you doing?",
                "Taking a breath with me, how are you feeling right now?",
                "Just checking in, how are you in this moment?"
        );
    }

    public List<String> whatElse() {
        return List.of(
                "What else do you notice?",
                "Is there anything else you're aware of?",
                "What else is there for you?"
        );
    }

    public List<String> patternInquiry() {
        return List.of(
                "How do you know when that feeling starts? What's happening in that moment?",
                "When does it usually begin? What's going on around you then?",
                "What tends to set it off? What do you notice first?"
        );
    }

    public List<String> assessReadiness() {
        return List.of(
                "What haven't I understood? Is there more I should know?",
                "Is there anything else I should know before we try something together?",
                "Have I missed anything important?"
        );
    }

    public List<String> requestPermission() {
        return List.of(
                "I'm going to guide you through a brief process to help your body settle. Are you ready?",
                "I'd like to take you through a short exercise for your body. Shall we try it?",
                "There's a simple thing we can do together to help you settle. Would you be open to it?"
        );
    }

    public List<String> reassurePermission() {
        return List.of(
                "It's very simple, and you can stop at any point. Ready to try?",
                "There's nothing you need to get right, just follow along with me. Shall we begin?",
                "We'll go gently, one small step at a time. Would you like to try?"
        );
    }

    public String beginSequence() {
        return "Great, let's begin.";
    }

    public String instruction(CheckpointStep step) {
        switch (step) {
            case LOWER_JAW:
                return "Let your jaw drop slightly, just a little, so your teeth aren't touching.";
            case RELAX_TONGUE:
                return "Now let your tongue rest softly at the bottom of your mouth.";
            case BREATHE_SLOWER:
            default:
                return "And breathe a little slower than you normally would, letting each exhale be longer.";
        }
    }

    public List<String> checkpointQuestions() {
        return List.of(
                "Do you notice yourself getting more tense or more calm?",
                "Are you feeling more tense, or more calm?",
                "What do you notice, more calm or more tense?",
                "Is your body moving towards calm, or towards tension?",
                "As you do that, does it feel calmer or tenser?",
                "Notice what happens. More relaxed, or more tense?"
        );
    }

    public String normalizeResistance() {
        return "That's completely normal. When we first pay attention, the body sometimes holds on a little. "
                + "Let's try that again, gently.";
    }

    public String giveItAMoment() {
        return "That's okay, give it a moment.";
    }

    public String checkpointClarify() {
        return "Just notice your body for a second, there's no right answer.";
    }

    public String sequenceComplete(boolean downRegulated) {
        if (downRegulated) {
            return "Beautiful. Your breathing has slowed and your body is softer. That's your system settling. "
                    + "Notice how that feels, and remember you can come back to this anytime.";
        }
        return "Well done. Notice how your body feels now compared with when we started, and take that with you.";
    }

    public String sessionClosed() {
        return "We've finished for today. Take a moment with how you feel, and come back whenever you'd like.";
    }

    public List<String> clarifyConfusion() {
        return List.of(
                "Let me say that differently. What's on your mind right now?",
                "Sorry, I'll put it more simply. What are you feeling at the moment?",
                "No problem. What would be most helpful to talk about?"
        );
    }

    /** Statements without a question, used when every question variant was asked recently. */
    public List<String> holdingStatements() {
        return List.of(
                "Take your time with that. Whatever you notice is welcome.",
                "Let's stay with that for a moment. There's no rush.",
                "That's alright. Just notice whatever comes up for you."
        );
    }

    public List<String> engagementCheck(String intervention) {
        if ("disengagement_check".equals(intervention)) {
            return List.of(
                    "I notice things have gone a bit quiet. Are you still with me?",
                    "It's okay if this feels like a lot. Would you like to keep going?",
                    "We can slow down whenever you like. How are you finding this so far?"
            );
        }
        return List.of(
                "I want to make sure this is useful for you. What's coming up for you as we talk?",
                "You've been with me through quite a bit. How is this landing for you?",
                "Let's check in for a second. Is this feeling helpful so far?"
        );
    }

    public String handoffSuggestion() {
        return "It might also help to talk this through with someone who can be there with you, like a counsellor "
                + "or someone you trust.";
    }

    public List<String> generalInquiry() {
        return List.of(
                "Can you tell me a bit more about that?",
                "What feels most important about that for you?",
                "How is that for you right now?"
        );
    }
}
